package com.kopitra.admin.application.shared.dto;

import java.time.Instant;

/**
 * 一次發布失敗的紀錄
 *
 * @param streamId 失敗事件所屬事件流
 * @param version  失敗事件版本
 * @param eventType 事件類型標籤
 * @param reason   失敗原因
 * @param failedAt 發生時間
 */
public record PublishFailure(String streamId, long version, String eventType, String reason, Instant failedAt) {
}
