package com.kopitra.admin.application.service.adminuser;

import java.util.List;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.adminuser.query.ListAdminUsersQuery;
import com.kopitra.admin.application.port.AdminUserReadModelPort;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ListAdminUsersHandler implements QueryHandler<ListAdminUsersQuery, List<AdminUserReadModel>> {

	private final AdminUserReadModelPort readModels;

	@Override
	public Class<ListAdminUsersQuery> queryType() {
		return ListAdminUsersQuery.class;
	}

	@Override
	public List<AdminUserReadModel> handle(ListAdminUsersQuery query) {
		return readModels.list(query.tenantId());
	}
}
