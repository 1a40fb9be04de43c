package com.kopitra.admin.application.domain.integration.query;

import java.util.List;

import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.shared.cqrs.Query;

public record ListEaIntegrationEventsQuery(String tenantId) implements Query<List<EaIntegrationEvent>> {
}
