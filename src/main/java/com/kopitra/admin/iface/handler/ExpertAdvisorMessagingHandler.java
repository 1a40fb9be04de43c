package com.kopitra.admin.iface.handler;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorApproved;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorRegistered;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorStatusChanged;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.DomainEventTypes;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.MessageBusPort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.dto.BusMessage;

import lombok.RequiredArgsConstructor;

/**
 * 將 Expert Advisor 事件轉發至 {@value #TOPIC} 主題，讓 EA 伺服器同步狀態
 */
@Order(10)
@Component
@RequiredArgsConstructor
public class ExpertAdvisorMessagingHandler implements DomainEventHandler {

	public static final String TOPIC = "expert-advisors";

	private final MessageBusPort messageBus;

	@Override
	public Set<Class<? extends DomainEvent>> subscribedEvents() {
		return Set.of(ExpertAdvisorRegistered.class, ExpertAdvisorApproved.class, ExpertAdvisorStatusChanged.class);
	}

	@Override
	public void handle(EventEnvelope envelope) {
		DomainEvent event = envelope.payload();
		Map<String, Object> attributes = new HashMap<>();
		String tenantId;
		String expertAdvisorId;
		if (event instanceof ExpertAdvisorRegistered e) {
			tenantId = e.tenantId();
			expertAdvisorId = e.expertAdvisorId();
			attributes.put("displayName", e.displayName());
			attributes.put("description", e.description());
			attributes.put("requestedBy", e.requestedBy());
		} else if (event instanceof ExpertAdvisorApproved e) {
			tenantId = e.tenantId();
			expertAdvisorId = e.expertAdvisorId();
			attributes.put("approvedBy", e.approvedBy());
		} else if (event instanceof ExpertAdvisorStatusChanged e) {
			tenantId = e.tenantId();
			expertAdvisorId = e.expertAdvisorId();
			attributes.put("status", e.status().name());
			if (e.reason() != null) {
				attributes.put("reason", e.reason());
			}
		} else {
			return;
		}
		messageBus.publish(TOPIC, new BusMessage(DomainEventTypes.tagOf(event), tenantId, expertAdvisorId,
				envelope.timestamp(), attributes));
	}
}
