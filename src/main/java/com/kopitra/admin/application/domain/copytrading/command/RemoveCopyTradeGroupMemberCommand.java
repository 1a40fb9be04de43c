package com.kopitra.admin.application.domain.copytrading.command;

import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RemoveCopyTradeGroupMemberCommand implements Command<CopyTradeGroupReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String groupId;
	@NotBlank
	String memberId;
	@NotBlank
	String requestedBy;
}
