package com.kopitra.admin.application.domain.copytrading.command;

import java.math.BigDecimal;

import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;
import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;

/**
 * 新增或更新跟單群組成員
 */
@Value
@Builder
public class UpsertCopyTradeGroupMemberCommand implements Command<CopyTradeGroupReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String groupId;
	@NotBlank
	String memberId;
	@NotNull
	CopyTradeMemberRole role;
	@NotNull
	RiskStrategy riskStrategy;
	@NotNull
	@Positive
	BigDecimal allocation;
	@NotBlank
	String requestedBy;
}
