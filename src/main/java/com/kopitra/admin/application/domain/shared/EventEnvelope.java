package com.kopitra.admin.application.domain.shared;

import java.time.Instant;
import java.util.Map;

/**
 * <h1>事件信封 (Event Envelope)</h1>
 * <p>
 * 已持久化事件的不可變紀錄，攜帶聚合識別、版本 (由 0 起算) 與附加 metadata。一經寫入即不可修改或刪除。
 * </p>
 *
 * @param aggregateId   聚合識別碼
 * @param aggregateType 聚合類型名稱
 * @param version       該聚合內的序號，同一聚合內嚴格遞增且不跳號
 * @param payload       領域事件本體
 * @param timestamp     寫入時間
 * @param metadata      附加資訊 (例如 eventType)
 */
public record EventEnvelope(String aggregateId, String aggregateType, long version, DomainEvent payload,
		Instant timestamp, Map<String, String> metadata) {

	public EventEnvelope {
		if (version < 0) {
			throw new IllegalArgumentException("事件版本不可小於 0: " + version);
		}
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	/**
	 * 事件流名稱，格式為 {@code 類型-識別碼}
	 */
	public String streamId() {
		return aggregateType + "-" + aggregateId;
	}
}
