package com.kopitra.admin.application.domain.expertadvisor.command;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;
import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * 手動變更 Expert Advisor 狀態，reason 可省略
 */
@Value
@Builder
public class UpdateExpertAdvisorStatusCommand implements Command<ExpertAdvisorReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String expertAdvisorId;
	@NotNull
	ExpertAdvisorStatus status;
	String reason;
	@NotBlank
	String requestedBy;
}
