package com.kopitra.admin.application.port;

import java.util.List;
import java.util.Optional;

import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

/**
 * Expert Advisor 讀取模型 Port
 */
public interface ExpertAdvisorReadModelPort {

	Optional<ExpertAdvisorReadModel> get(String tenantId, String expertAdvisorId);

	List<ExpertAdvisorReadModel> list(String tenantId);

	void upsert(ExpertAdvisorReadModel model);

	void remove(String tenantId, String expertAdvisorId);

	void clear();
}
