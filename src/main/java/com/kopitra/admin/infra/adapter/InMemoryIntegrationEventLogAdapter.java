package com.kopitra.admin.infra.adapter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.port.IntegrationEventLogPort;

/**
 * 依租戶分開保存的 EA 整合事件紀錄
 */
@Component
public class InMemoryIntegrationEventLogAdapter implements IntegrationEventLogPort {

	private static final Comparator<EaIntegrationEvent> NEWEST_FIRST = Comparator
			.comparing(EaIntegrationEvent::occurredAt).thenComparing(EaIntegrationEvent::receivedAt).reversed();

	private final Map<String, List<EaIntegrationEvent>> events = new ConcurrentHashMap<>();

	@Override
	public void append(EaIntegrationEvent event) {
		List<EaIntegrationEvent> tenantEvents = events.computeIfAbsent(event.tenantId(), k -> new ArrayList<>());
		synchronized (tenantEvents) {
			tenantEvents.add(event);
		}
	}

	@Override
	public List<EaIntegrationEvent> list(String tenantId) {
		List<EaIntegrationEvent> tenantEvents = events.get(tenantId);
		if (tenantEvents == null) {
			return List.of();
		}
		synchronized (tenantEvents) {
			return tenantEvents.stream().sorted(NEWEST_FIRST).toList();
		}
	}
}
