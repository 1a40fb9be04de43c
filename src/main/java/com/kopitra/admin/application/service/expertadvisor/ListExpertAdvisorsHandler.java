package com.kopitra.admin.application.service.expertadvisor;

import java.util.List;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.expertadvisor.query.ListExpertAdvisorsQuery;
import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ListExpertAdvisorsHandler
		implements QueryHandler<ListExpertAdvisorsQuery, List<ExpertAdvisorReadModel>> {

	private final ExpertAdvisorReadModelPort readModels;

	@Override
	public Class<ListExpertAdvisorsQuery> queryType() {
		return ListExpertAdvisorsQuery.class;
	}

	@Override
	public List<ExpertAdvisorReadModel> handle(ListExpertAdvisorsQuery query) {
		return readModels.list(query.tenantId());
	}
}
