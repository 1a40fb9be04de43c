package com.kopitra.admin.application.domain.adminuser.event;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;

@JsonTypeName("admin-user-roles-updated")
public record AdminUserRolesUpdated(String tenantId, String userId, List<AdminUserRole> roles, Instant updatedAt,
		String updatedBy) implements AdminUserEvent {

	public AdminUserRolesUpdated {
		roles = List.copyOf(roles);
	}
}
