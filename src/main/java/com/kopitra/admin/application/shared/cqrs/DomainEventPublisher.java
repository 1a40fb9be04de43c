package com.kopitra.admin.application.shared.cqrs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.PublishFailureException;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>領域事件發布器 (Domain Event Publisher)</h1>
 * <p>
 * 依寫入順序逐筆發布事件，每筆事件依註冊順序同步呼叫所有訂閱該具體類型的 Handler。
 * </p>
 * <p>
 * 任何 Handler 失敗都會以 {@link PublishFailureException} 往上拋，已寫入的事件不會回滾。
 * </p>
 * <p>
 * 讀取模型重建期間以寫鎖獨占，一般的寫入、發布與查詢共用讀鎖，因此重建時不會有即時事件穿插，也不會讀到重建到一半的讀取模型。
 * </p>
 */
@Slf4j
public class DomainEventPublisher {

	private final List<DomainEventHandler> handlers;
	private final Map<Class<? extends DomainEvent>, List<DomainEventHandler>> routes;
	private final ReentrantReadWriteLock rebuildLock = new ReentrantReadWriteLock();

	public DomainEventPublisher(List<? extends DomainEventHandler> eventHandlers) {
		this.handlers = List.copyOf(eventHandlers);
		Map<Class<? extends DomainEvent>, List<DomainEventHandler>> table = new LinkedHashMap<>();
		for (DomainEventHandler handler : handlers) {
			for (Class<? extends DomainEvent> eventType : handler.subscribedEvents()) {
				table.computeIfAbsent(eventType, k -> new ArrayList<>()).add(handler);
			}
		}
		table.replaceAll((k, v) -> Collections.unmodifiableList(v));
		this.routes = Collections.unmodifiableMap(table);
		log.info(">>> [Publisher] 已註冊 {} 個事件處理器，涵蓋 {} 種事件", handlers.size(), routes.size());
	}

	/**
	 * 發布一批剛寫入的事件
	 *
	 * @param envelopes 依版本排序的事件
	 * @throws PublishFailureException 任一 Handler 失敗
	 */
	public void publish(List<EventEnvelope> envelopes) {
		withReadModelsStable(() -> {
			for (EventEnvelope envelope : envelopes) {
				for (DomainEventHandler handler : routesFor(envelope)) {
					try {
						handler.handle(envelope);
					} catch (RuntimeException e) {
						log.error(">>> [Publisher] {} 處理 {}@{} 失敗: {}", handler.getClass().getSimpleName(),
								envelope.streamId(), envelope.version(), e.getMessage());
						throw new PublishFailureException(envelope, envelopes, e);
					}
				}
			}
			return null;
		});
	}

	/**
	 * 在讀取模型不會被重建的期間內執行，可重入
	 */
	public <T> T withReadModelsStable(Supplier<T> work) {
		return runLocked(rebuildLock.readLock(), work);
	}

	/**
	 * 獨占讀取模型執行重建，期間所有寫入、發布與查詢都會等待
	 */
	public <T> T withReadModelsExclusive(Supplier<T> work) {
		return runLocked(rebuildLock.writeLock(), work);
	}

	/**
	 * 僅將事件送往可重播的 Handler，供讀取模型重建使用
	 */
	public void replay(EventEnvelope envelope) {
		for (DomainEventHandler handler : routesFor(envelope)) {
			if (handler.replayable()) {
				handler.handle(envelope);
			}
		}
	}

	public List<DomainEventHandler> getHandlers() {
		return handlers;
	}

	private static <T> T runLocked(Lock lock, Supplier<T> work) {
		lock.lock();
		try {
			return work.get();
		} finally {
			lock.unlock();
		}
	}

	private List<DomainEventHandler> routesFor(EventEnvelope envelope) {
		return routes.getOrDefault(envelope.payload().getClass(), List.of());
	}
}
