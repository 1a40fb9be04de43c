package com.kopitra.admin.application.domain.expertadvisor.command;

import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * 註冊新的 Expert Advisor，註冊後進入待審核
 */
@Value
@Builder
public class RegisterExpertAdvisorCommand implements Command<ExpertAdvisorReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String expertAdvisorId;
	@NotBlank
	String displayName;
	@NotNull
	String description;
	@NotBlank
	String requestedBy;
}
