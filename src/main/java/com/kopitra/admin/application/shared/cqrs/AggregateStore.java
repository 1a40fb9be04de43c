package com.kopitra.admin.application.shared.cqrs;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import com.kopitra.admin.application.domain.shared.AggregateRoot;
import com.kopitra.admin.application.domain.shared.DomainEventTypes;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.ConcurrencyConflictException;
import com.kopitra.admin.application.domain.shared.exception.PublishFailureException;
import com.kopitra.admin.application.port.EventStorePort;
import com.kopitra.admin.application.port.PublishFailureLogPort;
import com.kopitra.admin.application.shared.dto.PublishFailure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>聚合儲存 (Aggregate Store)</h1>
 * <p>
 * <b>職責：</b> 封裝「載入 → 重播 → 變更 → 樂觀寫入 → 發布」的完整流程，Handler 只需提供變更邏輯。
 * </p>
 *
 * <h2>流程：</h2>
 * <ol>
 * <li>讀取事件流並重播至全新的聚合實例 (聚合不跨呼叫快取)。</li>
 * <li>執行 mutator；若沒有產生事件則直接回傳空清單，不做任何寫入。</li>
 * <li>以重播後的版本作為預期版本追加事件，衝突時直接拋出 {@link ConcurrencyConflictException}，不在此重試。</li>
 * <li>依寫入順序發布事件；發布失敗會記錄並拋出 {@link PublishFailureException}，寫入不回滾。</li>
 * </ol>
 *
 * <p>
 * 執行緒中斷視為取消：寫入前偵測到中斷會以 {@link CancellationException} 結束且不留下任何事件；寫入後則照常發布。
 * </p>
 * <p>
 * 同一事件流的「寫入 + 發布」在流鎖內完成，讀取模型收到的事件順序與版本順序一致。 變更邏輯 (mutator) 在流鎖之外執行，巢狀寫入同一聚合仍以版本衝突結束。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class AggregateStore {

	private final EventStorePort eventStore;
	private final DomainEventPublisher publisher;
	private final PublishFailureLogPort publishFailureLog;
	private final Clock clock;
	private final Map<String, ReentrantLock> streamLocks = new ConcurrentHashMap<>();

	/**
	 * 載入並重播聚合
	 *
	 * @param factory 以識別碼建立空聚合
	 * @param id      聚合識別碼
	 */
	public <A extends AggregateRoot<?, ?>> A load(Function<String, A> factory, String id) {
		A aggregate = factory.apply(id);
		aggregate.loadFromHistory(eventStore.load(aggregate.aggregateType(), id));
		return aggregate;
	}

	/**
	 * 對聚合執行一次變更並持久化
	 *
	 * @param factory 以識別碼建立空聚合
	 * @param id      聚合識別碼
	 * @param mutator 變更邏輯，透過聚合方法產生事件
	 * @return 本次寫入的事件；無變更時為空清單
	 */
	public <A extends AggregateRoot<?, ?>> List<EventEnvelope> update(Function<String, A> factory, String id,
			Consumer<? super A> mutator) {
		return publisher.withReadModelsStable(() -> write(factory, id, mutator));
	}

	/**
	 * 變更聚合後緊接著讀取結果，兩者之間讀取模型不會被重建
	 *
	 * @param reader 寫入 (與發布) 完成後執行
	 */
	public <A extends AggregateRoot<?, ?>, T> T updateThenRead(Function<String, A> factory, String id,
			Consumer<? super A> mutator, Supplier<T> reader) {
		return publisher.withReadModelsStable(() -> {
			write(factory, id, mutator);
			return reader.get();
		});
	}

	private <A extends AggregateRoot<?, ?>> List<EventEnvelope> write(Function<String, A> factory, String id,
			Consumer<? super A> mutator) {
		checkCancelled(id);
		A aggregate = load(factory, id);

		mutator.accept(aggregate);
		if (aggregate.getUncommittedEvents().isEmpty()) {
			log.debug(">>> [AggregateStore] {}-{} 無狀態變更，略過寫入", aggregate.aggregateType(), id);
			return List.of();
		}

		checkCancelled(id);
		ReentrantLock streamLock = streamLocks.computeIfAbsent(aggregate.aggregateType() + "-" + id,
				key -> new ReentrantLock());
		streamLock.lock();
		try {
			List<EventEnvelope> appended = eventStore.append(aggregate.aggregateType(), id,
					aggregate.getPersistedVersion(), aggregate.getUncommittedEvents(),
					Map.of("aggregateType", aggregate.aggregateType()));
			aggregate.markCommitted(appended.get(appended.size() - 1).version());
			log.debug(">>> [AggregateStore] {}-{} 寫入 {} 筆事件，最新版本 {}", aggregate.aggregateType(), id,
					appended.size(), aggregate.getPersistedVersion());

			try {
				publisher.publish(appended);
			} catch (PublishFailureException e) {
				EventEnvelope failed = e.getFailedEnvelope();
				publishFailureLog.record(new PublishFailure(failed.streamId(), failed.version(),
						DomainEventTypes.tagOf(failed.payload()), e.getCause().getMessage(), clock.instant()));
				log.warn(">>> [AggregateStore] 事件已寫入但發布失敗，讀取模型待重建: {}", e.getMessage());
				throw e;
			}
			return appended;
		} finally {
			streamLock.unlock();
		}
	}

	private void checkCancelled(String id) {
		if (Thread.currentThread().isInterrupted()) {
			throw new CancellationException("聚合 " + id + " 的變更已取消");
		}
	}
}
