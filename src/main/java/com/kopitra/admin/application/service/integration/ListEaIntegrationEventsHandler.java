package com.kopitra.admin.application.service.integration;

import java.util.List;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.domain.integration.query.ListEaIntegrationEventsQuery;
import com.kopitra.admin.application.port.IntegrationEventLogPort;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ListEaIntegrationEventsHandler
		implements QueryHandler<ListEaIntegrationEventsQuery, List<EaIntegrationEvent>> {

	private final IntegrationEventLogPort eventLog;

	@Override
	public Class<ListEaIntegrationEventsQuery> queryType() {
		return ListEaIntegrationEventsQuery.class;
	}

	@Override
	public List<EaIntegrationEvent> handle(ListEaIntegrationEventsQuery query) {
		return eventLog.list(query.tenantId());
	}
}
