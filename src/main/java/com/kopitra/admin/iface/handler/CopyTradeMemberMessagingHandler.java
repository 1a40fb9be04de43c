package com.kopitra.admin.iface.handler;

import java.util.Map;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberRemoved;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberUpserted;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.DomainEventTypes;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.MessageBusPort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.dto.BusMessage;

import lombok.RequiredArgsConstructor;

/**
 * 將跟單成員異動轉發至 {@value #TOPIC} 主題
 */
@Order(10)
@Component
@RequiredArgsConstructor
public class CopyTradeMemberMessagingHandler implements DomainEventHandler {

	public static final String TOPIC = "copy-trade-members";

	private final MessageBusPort messageBus;

	@Override
	public Set<Class<? extends DomainEvent>> subscribedEvents() {
		return Set.of(CopyTradeGroupMemberUpserted.class, CopyTradeGroupMemberRemoved.class);
	}

	@Override
	public void handle(EventEnvelope envelope) {
		DomainEvent event = envelope.payload();
		if (event instanceof CopyTradeGroupMemberUpserted e) {
			messageBus.publish(TOPIC, new BusMessage(DomainEventTypes.tagOf(event), e.tenantId(), e.groupId(),
					envelope.timestamp(),
					Map.of("memberId", e.memberId(), "role", e.role().name(), "riskStrategy",
							e.riskStrategy().name(), "allocation", e.allocation(), "updatedBy", e.updatedBy())));
		} else if (event instanceof CopyTradeGroupMemberRemoved e) {
			messageBus.publish(TOPIC, new BusMessage(DomainEventTypes.tagOf(event), e.tenantId(), e.groupId(),
					envelope.timestamp(), Map.of("memberId", e.memberId(), "removedBy", e.removedBy())));
		}
	}
}
