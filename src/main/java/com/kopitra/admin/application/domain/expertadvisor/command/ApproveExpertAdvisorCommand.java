package com.kopitra.admin.application.domain.expertadvisor.command;

import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApproveExpertAdvisorCommand implements Command<ExpertAdvisorReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String expertAdvisorId;
	@NotBlank
	String approvedBy;
}
