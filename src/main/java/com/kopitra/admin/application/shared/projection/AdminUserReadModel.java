package com.kopitra.admin.application.shared.projection;

import java.time.Instant;
import java.util.List;

import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;

/**
 * 管理者帳號讀取模型
 */
public record AdminUserReadModel(String tenantId, String userId, String email, String displayName,
		List<AdminUserRole> roles, boolean emailEnabled, List<String> topics, Instant updatedAt) {

	public AdminUserReadModel {
		roles = List.copyOf(roles);
		topics = List.copyOf(topics);
	}
}
