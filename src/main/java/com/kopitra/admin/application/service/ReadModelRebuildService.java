package com.kopitra.admin.application.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.EventStorePort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.cqrs.DomainEventPublisher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>讀取模型重建服務</h1>
 * <p>
 * 清空所有可重播的投影，再依提交順序將事件日誌完整重播一次。對外發送訊息的 Handler 不參與重播。
 * </p>
 * <p>
 * 重建期間獨占發布器，即時的寫入、發布與查詢會等到重播結束後才繼續，重建開始前已寫入的事件都包含在這次重播內。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadModelRebuildService {

	private final EventStorePort eventStore;
	private final DomainEventPublisher publisher;

	/**
	 * @return 重播的事件筆數
	 */
	public int rebuild() {
		return publisher.withReadModelsExclusive(this::replayAll);
	}

	private int replayAll() {
		long startTime = System.currentTimeMillis();
		List<DomainEventHandler> projections = publisher.getHandlers().stream()
				.filter(DomainEventHandler::replayable)
				.toList();
		projections.forEach(DomainEventHandler::reset);

		List<EventEnvelope> history = eventStore.loadAll();
		history.forEach(publisher::replay);

		log.info(">>> [Rebuild] 已重建 {} 個投影，重播 {} 筆事件，耗時 {} ms", projections.size(), history.size(),
				System.currentTimeMillis() - startTime);
		return history.size();
	}
}
