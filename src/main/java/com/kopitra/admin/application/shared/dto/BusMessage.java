package com.kopitra.admin.application.shared.dto;

import java.time.Instant;
import java.util.Map;

/**
 * 送往訊息匯流排的訊息
 *
 * @param type       訊息類型，例如 {@code expert-advisor-registered}
 * @param tenantId   租戶
 * @param businessId 業務識別碼
 * @param occurredAt 事件時間
 * @param attributes 其他欄位
 */
public record BusMessage(String type, String tenantId, String businessId, Instant occurredAt,
		Map<String, Object> attributes) {

	public BusMessage {
		attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
	}
}
