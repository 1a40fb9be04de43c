package com.kopitra.admin.application.domain.adminuser.event;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;

@JsonTypeName("admin-user-provisioned")
public record AdminUserProvisioned(String tenantId, String userId, String email, String displayName,
		List<AdminUserRole> roles, Instant provisionedAt, String provisionedBy) implements AdminUserEvent {

	public AdminUserProvisioned {
		roles = List.copyOf(roles);
	}
}
