package com.kopitra.admin.application.domain.integration.model;

import java.time.Instant;

/**
 * 由 EA 介面回報的整合事件，僅供查詢，不屬於事件溯源的聚合
 *
 * @param occurredAt EA 端發生時間
 * @param receivedAt 後端收到時間
 */
public record EaIntegrationEvent(String tenantId, String source, String eventType, String payload,
		Instant occurredAt, Instant receivedAt) {
}
