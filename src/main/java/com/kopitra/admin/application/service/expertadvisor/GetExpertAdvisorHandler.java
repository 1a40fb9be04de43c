package com.kopitra.admin.application.service.expertadvisor;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.expertadvisor.query.GetExpertAdvisorQuery;
import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class GetExpertAdvisorHandler
		implements QueryHandler<GetExpertAdvisorQuery, Optional<ExpertAdvisorReadModel>> {

	private final ExpertAdvisorReadModelPort readModels;

	@Override
	public Class<GetExpertAdvisorQuery> queryType() {
		return GetExpertAdvisorQuery.class;
	}

	@Override
	public Optional<ExpertAdvisorReadModel> handle(GetExpertAdvisorQuery query) {
		return readModels.get(query.tenantId(), query.expertAdvisorId());
	}
}
