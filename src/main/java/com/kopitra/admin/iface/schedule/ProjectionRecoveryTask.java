package com.kopitra.admin.iface.schedule;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.PublishFailureLogPort;
import com.kopitra.admin.application.service.ReadModelRebuildService;
import com.kopitra.admin.application.shared.dto.PublishFailure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>讀取模型修復任務</h1>
 * <p>
 * 事件已寫入但發布失敗時，讀取模型會落後於事件日誌。本任務定期檢查失敗紀錄，有待處理項目時重建讀取模型，成功後清除紀錄。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectionRecoveryTask {

	private final PublishFailureLogPort publishFailureLog;
	private final ReadModelRebuildService rebuildService;

	@Scheduled(initialDelayString = "${kopitra.projection.recovery-delay:PT30S}",
			fixedDelayString = "${kopitra.projection.recovery-delay:PT30S}")
	public void recover() {
		List<PublishFailure> pending = publishFailureLog.pending();
		if (pending.isEmpty()) {
			return;
		}
		log.warn(">>> [Recovery] 偵測到 {} 筆發布失敗，開始重建讀取模型", pending.size());

		try {
			rebuildService.rebuild();
			int cleared = publishFailureLog.clear(pending);
			log.info(">>> [Recovery] 讀取模型已修復，清除 {} 筆失敗紀錄", cleared);
		} catch (Exception e) {
			log.error(">>> [Recovery] 重建失敗，保留失敗紀錄待下回合處理: {}", e.getMessage(), e);
		}
	}
}
