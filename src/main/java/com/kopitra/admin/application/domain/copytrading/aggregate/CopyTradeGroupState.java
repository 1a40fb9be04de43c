package com.kopitra.admin.application.domain.copytrading.aggregate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;

/**
 * CopyTradeGroup 聚合的不可變狀態，成員以 memberId 為鍵
 */
public record CopyTradeGroupState(String tenantId, String groupId, String name, String description,
		String createdBy, Instant createdAt, Map<String, Member> members) {

	public static final CopyTradeGroupState EMPTY = new CopyTradeGroupState(null, null, null, null, null, null,
			Map.of());

	public CopyTradeGroupState {
		members = Map.copyOf(members);
	}

	public boolean created() {
		return tenantId != null;
	}

	public record Member(String memberId, CopyTradeMemberRole role, RiskStrategy riskStrategy, BigDecimal allocation,
			Instant updatedAt, String updatedBy) {
	}
}
