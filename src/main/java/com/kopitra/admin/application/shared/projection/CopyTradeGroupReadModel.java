package com.kopitra.admin.application.shared.projection;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;

/**
 * 跟單群組讀取模型，成員依 memberId 排序
 */
public record CopyTradeGroupReadModel(String tenantId, String groupId, String name, String description,
		String createdBy, Instant createdAt, List<Member> members) {

	public CopyTradeGroupReadModel {
		members = List.copyOf(members);
	}

	public record Member(String memberId, CopyTradeMemberRole role, RiskStrategy riskStrategy, BigDecimal allocation,
			Instant updatedAt, String updatedBy) {
	}
}
