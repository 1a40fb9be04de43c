package com.kopitra.admin.application.domain.expertadvisor.aggregate;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;

/**
 * ExpertAdvisor 聚合的不可變狀態
 */
public record ExpertAdvisorState(String tenantId, String expertAdvisorId, String displayName, String description,
		String requestedBy, boolean approved, String approvedBy, ExpertAdvisorStatus status) {

	public static final ExpertAdvisorState EMPTY = new ExpertAdvisorState(null, null, null, null, null, false, null,
			ExpertAdvisorStatus.DRAFT);

	public boolean registered() {
		return tenantId != null;
	}

	ExpertAdvisorState withStatus(ExpertAdvisorStatus next) {
		return new ExpertAdvisorState(tenantId, expertAdvisorId, displayName, description, requestedBy, approved,
				approvedBy, next);
	}
}
