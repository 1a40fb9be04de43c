package com.kopitra.admin.application.domain.expertadvisor.query;

import java.util.List;

import com.kopitra.admin.application.shared.cqrs.Query;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

public record ListExpertAdvisorsQuery(String tenantId) implements Query<List<ExpertAdvisorReadModel>> {
}
