package com.kopitra.admin.application.domain.adminuser.query;

import java.util.List;

import com.kopitra.admin.application.shared.cqrs.Query;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

public record ListAdminUsersQuery(String tenantId) implements Query<List<AdminUserReadModel>> {
}
