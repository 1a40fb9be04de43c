package com.kopitra.admin.infra.adapter;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.AdminUserReadModelPort;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

@Component
public class AdminUserReadModelAdapter extends InMemoryReadModelStore<AdminUserReadModel>
		implements AdminUserReadModelPort {

	@Override
	public Optional<AdminUserReadModel> get(String tenantId, String userId) {
		return find(tenantId, userId);
	}

	@Override
	public List<AdminUserReadModel> list(String tenantId) {
		return findAll(tenantId);
	}

	@Override
	public void upsert(AdminUserReadModel model) {
		save(model);
	}

	@Override
	public void remove(String tenantId, String userId) {
		delete(tenantId, userId);
	}

	@Override
	public void clear() {
		deleteAll();
	}

	@Override
	protected String tenantIdOf(AdminUserReadModel model) {
		return model.tenantId();
	}

	@Override
	protected String businessIdOf(AdminUserReadModel model) {
		return model.userId();
	}
}
