package com.kopitra.admin.application.domain.expertadvisor.query;

import java.util.Optional;

import com.kopitra.admin.application.shared.cqrs.Query;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

public record GetExpertAdvisorQuery(String tenantId, String expertAdvisorId)
		implements Query<Optional<ExpertAdvisorReadModel>> {
}
