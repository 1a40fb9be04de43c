package com.kopitra.admin.application.domain.adminuser.command;

import java.util.List;

import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 開通管理者帳號
 */
@Value
@Builder
public class ProvisionAdminUserCommand implements Command<AdminUserReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String userId;
	@NotBlank
	@Email
	String email;
	@NotBlank
	String displayName;
	@NotEmpty
	@Singular
	List<@NotNull AdminUserRole> roles;
	@NotBlank
	String requestedBy;
}
