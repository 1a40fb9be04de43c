package com.kopitra.admin.application.domain.integration.command;

import java.time.Instant;

import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.shared.cqrs.Command;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * 記錄一筆 EA 整合事件，occurredAt 未提供時以收到時間代替
 */
@Value
@Builder
public class RecordEaIntegrationEventCommand implements Command<EaIntegrationEvent> {

	@NotBlank
	String tenantId;
	@NotBlank
	String source;
	@NotBlank
	String eventType;
	@NotNull
	String payload;
	Instant occurredAt;
}
