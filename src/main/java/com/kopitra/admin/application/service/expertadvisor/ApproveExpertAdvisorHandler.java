package com.kopitra.admin.application.service.expertadvisor;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.ExpertAdvisor;
import com.kopitra.admin.application.domain.expertadvisor.command.ApproveExpertAdvisorCommand;
import com.kopitra.admin.application.domain.shared.exception.ReadModelMissingException;
import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApproveExpertAdvisorHandler
		implements CommandHandler<ApproveExpertAdvisorCommand, ExpertAdvisorReadModel> {

	private final AggregateStore aggregateStore;
	private final ExpertAdvisorReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<ApproveExpertAdvisorCommand> commandType() {
		return ApproveExpertAdvisorCommand.class;
	}

	@Override
	public ExpertAdvisorReadModel handle(ApproveExpertAdvisorCommand command) {
		ExpertAdvisorReadModel result = aggregateStore.updateThenRead(ExpertAdvisor::new,
				ExpertAdvisor.idFor(command.getTenantId(), command.getExpertAdvisorId()),
				ea -> ea.approve(command.getApprovedBy(), clock.instant()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("ExpertAdvisor", command.getTenantId(),
								command.getExpertAdvisorId())));
		log.info(">>> [ExpertAdvisor] 租戶 {} 的 {} 已由 {} 核准", command.getTenantId(), command.getExpertAdvisorId(),
				command.getApprovedBy());
		return result;
	}

	@Override
	public Optional<ExpertAdvisorReadModel> currentResult(ApproveExpertAdvisorCommand command) {
		return readModels.get(command.getTenantId(), command.getExpertAdvisorId());
	}
}
