package com.kopitra.admin.application.domain.adminuser.command;

import java.util.List;

import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 以新的角色集合取代管理者目前的角色
 */
@Value
@Builder
public class UpdateAdminUserRolesCommand implements Command<AdminUserReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String userId;
	@NotEmpty
	@Singular
	List<@NotNull AdminUserRole> roles;
	@NotBlank
	String requestedBy;
}
