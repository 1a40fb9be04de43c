package com.kopitra.admin.infra.adapter;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

@Component
public class ExpertAdvisorReadModelAdapter extends InMemoryReadModelStore<ExpertAdvisorReadModel>
		implements ExpertAdvisorReadModelPort {

	@Override
	public Optional<ExpertAdvisorReadModel> get(String tenantId, String expertAdvisorId) {
		return find(tenantId, expertAdvisorId);
	}

	@Override
	public List<ExpertAdvisorReadModel> list(String tenantId) {
		return findAll(tenantId);
	}

	@Override
	public void upsert(ExpertAdvisorReadModel model) {
		save(model);
	}

	@Override
	public void remove(String tenantId, String expertAdvisorId) {
		delete(tenantId, expertAdvisorId);
	}

	@Override
	public void clear() {
		deleteAll();
	}

	@Override
	protected String tenantIdOf(ExpertAdvisorReadModel model) {
		return model.tenantId();
	}

	@Override
	protected String businessIdOf(ExpertAdvisorReadModel model) {
		return model.expertAdvisorId();
	}
}
