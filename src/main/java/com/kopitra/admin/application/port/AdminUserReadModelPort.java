package com.kopitra.admin.application.port;

import java.util.List;
import java.util.Optional;

import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

/**
 * 管理者讀取模型 Port
 */
public interface AdminUserReadModelPort {

	Optional<AdminUserReadModel> get(String tenantId, String userId);

	List<AdminUserReadModel> list(String tenantId);

	void upsert(AdminUserReadModel model);

	void remove(String tenantId, String userId);

	void clear();
}
