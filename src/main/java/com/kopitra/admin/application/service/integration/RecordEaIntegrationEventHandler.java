package com.kopitra.admin.application.service.integration;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.integration.command.RecordEaIntegrationEventCommand;
import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.port.IntegrationEventLogPort;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 記錄 EA 整合事件，receivedAt 取自系統時鐘
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordEaIntegrationEventHandler
		implements CommandHandler<RecordEaIntegrationEventCommand, EaIntegrationEvent> {

	private final IntegrationEventLogPort eventLog;
	private final Clock clock;

	@Override
	public Class<RecordEaIntegrationEventCommand> commandType() {
		return RecordEaIntegrationEventCommand.class;
	}

	@Override
	public EaIntegrationEvent handle(RecordEaIntegrationEventCommand command) {
		Instant receivedAt = clock.instant();
		Instant occurredAt = command.getOccurredAt() != null ? command.getOccurredAt() : receivedAt;
		EaIntegrationEvent event = new EaIntegrationEvent(command.getTenantId(), command.getSource(),
				command.getEventType(), command.getPayload(), occurredAt, receivedAt);
		eventLog.append(event);
		log.info(">>> [Integration] 租戶 {} 收到 {} 的 {} 事件", command.getTenantId(), command.getSource(),
				command.getEventType());
		return event;
	}
}
