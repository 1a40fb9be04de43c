package com.kopitra.admin.application.domain.adminuser.aggregate;

import java.util.List;

import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;

/**
 * AdminUser 聚合的不可變狀態
 */
public record AdminUserState(String tenantId, String userId, String email, String displayName,
		List<AdminUserRole> roles, boolean emailEnabled, List<String> topics) {

	public static final AdminUserState EMPTY = new AdminUserState(null, null, null, null, List.of(), false,
			List.of());

	public boolean provisioned() {
		return tenantId != null;
	}
}
