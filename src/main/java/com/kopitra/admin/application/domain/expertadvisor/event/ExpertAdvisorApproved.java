package com.kopitra.admin.application.domain.expertadvisor.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("expert-advisor-approved")
public record ExpertAdvisorApproved(String tenantId, String expertAdvisorId, String approvedBy, Instant approvedAt)
		implements ExpertAdvisorEvent {
}
