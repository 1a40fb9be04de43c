package com.kopitra.admin.iface.schedule;

import java.time.Clock;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.IdempotencyStorePort;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 冪等鍵自動清理任務
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyCleanupTask {

	private final IdempotencyStorePort idempotencyStore;
	private final Clock clock;

	/**
	 * 定期刪除已到期的冪等鍵，排程由 {@code kopitra.idempotency.cleanup-cron} 設定
	 */
	@Scheduled(cron = "${kopitra.idempotency.cleanup-cron:0 0 * * * *}")
	public void cleanupExpiredKeys() {
		log.debug(">>> [Cleanup] 開始清理到期冪等鍵...");

		try {
			int deleted = idempotencyStore.deleteExpired(clock.instant());
			if (deleted > 0) {
				log.info(">>> [Cleanup] 清理完成，共移除 {} 筆到期冪等鍵", deleted);
			}
		} catch (Exception e) {
			log.error(">>> [Cleanup] 清理過程發生異常: {}", e.getMessage(), e);
		}
	}
}
