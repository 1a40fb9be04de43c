package com.kopitra.admin.application.port;

import java.util.List;
import java.util.Map;

import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.ConcurrencyConflictException;

/**
 * 事件儲存 Port
 *
 * <p>
 * 只負責持久化與讀取事件流，不負責發布。
 * </p>
 */
public interface EventStorePort {

	/**
	 * 以樂觀鎖將事件追加至 {@code 類型-識別碼} 事件流。整批事件要嘛全部可見，要嘛全部不可見。
	 *
	 * @param aggregateType   聚合類型
	 * @param aggregateId     聚合識別碼
	 * @param expectedVersion 預期的最新版本，新事件流為 -1
	 * @param events          待寫入事件
	 * @param metadata        附加於每筆事件的 metadata
	 * @return 已寫入的事件信封，版本為 expectedVersion+1 起連續遞增
	 * @throws ConcurrencyConflictException 事件流最新版本與預期不符
	 */
	List<EventEnvelope> append(String aggregateType, String aggregateId, long expectedVersion,
			List<? extends DomainEvent> events, Map<String, String> metadata);

	/**
	 * 依版本順序讀取事件流，不存在時回傳空清單
	 */
	List<EventEnvelope> load(String aggregateType, String aggregateId);

	/**
	 * 依寫入順序讀取所有事件流的全部事件
	 */
	List<EventEnvelope> loadAll();
}
