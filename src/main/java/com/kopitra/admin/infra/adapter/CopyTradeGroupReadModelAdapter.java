package com.kopitra.admin.infra.adapter;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.CopyTradeGroupReadModelPort;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

@Component
public class CopyTradeGroupReadModelAdapter extends InMemoryReadModelStore<CopyTradeGroupReadModel>
		implements CopyTradeGroupReadModelPort {

	@Override
	public Optional<CopyTradeGroupReadModel> get(String tenantId, String groupId) {
		return find(tenantId, groupId);
	}

	@Override
	public List<CopyTradeGroupReadModel> list(String tenantId) {
		return findAll(tenantId);
	}

	@Override
	public void upsert(CopyTradeGroupReadModel model) {
		save(model);
	}

	@Override
	public void remove(String tenantId, String groupId) {
		delete(tenantId, groupId);
	}

	@Override
	public void clear() {
		deleteAll();
	}

	@Override
	protected String tenantIdOf(CopyTradeGroupReadModel model) {
		return model.tenantId();
	}

	@Override
	protected String businessIdOf(CopyTradeGroupReadModel model) {
		return model.groupId();
	}
}
