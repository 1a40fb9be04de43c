package com.kopitra.admin.application.shared.projection;

import java.time.Instant;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;

/**
 * Expert Advisor 讀取模型
 *
 * @param approvedBy 尚未核准時為 null
 */
public record ExpertAdvisorReadModel(String tenantId, String expertAdvisorId, String displayName,
		String description, ExpertAdvisorStatus status, String approvedBy, Instant updatedAt) {
}
