package com.kopitra.admin.application.domain.expertadvisor.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("expert-advisor-registered")
public record ExpertAdvisorRegistered(String tenantId, String expertAdvisorId, String displayName,
		String description, String requestedBy, Instant registeredAt) implements ExpertAdvisorEvent {
}
