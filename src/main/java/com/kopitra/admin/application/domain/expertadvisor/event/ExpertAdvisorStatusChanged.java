package com.kopitra.admin.application.domain.expertadvisor.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;

/**
 * @param reason 變更原因，可為 null
 */
@JsonTypeName("expert-advisor-status-changed")
public record ExpertAdvisorStatusChanged(String tenantId, String expertAdvisorId, ExpertAdvisorStatus status,
		String reason, Instant changedAt) implements ExpertAdvisorEvent {
}
