package com.kopitra.admin.application.domain.copytrading.event;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;

@JsonTypeName("copy-trade-member-upserted")
public record CopyTradeGroupMemberUpserted(String tenantId, String groupId, String memberId,
		CopyTradeMemberRole role, RiskStrategy riskStrategy, BigDecimal allocation, Instant updatedAt,
		String updatedBy) implements CopyTradeGroupEvent {
}
