package com.kopitra.admin.application.service.expertadvisor;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.ExpertAdvisor;
import com.kopitra.admin.application.domain.expertadvisor.command.UpdateExpertAdvisorStatusCommand;
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
public class UpdateExpertAdvisorStatusHandler
		implements CommandHandler<UpdateExpertAdvisorStatusCommand, ExpertAdvisorReadModel> {

	private final AggregateStore aggregateStore;
	private final ExpertAdvisorReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<UpdateExpertAdvisorStatusCommand> commandType() {
		return UpdateExpertAdvisorStatusCommand.class;
	}

	@Override
	public ExpertAdvisorReadModel handle(UpdateExpertAdvisorStatusCommand command) {
		ExpertAdvisorReadModel result = aggregateStore.updateThenRead(ExpertAdvisor::new,
				ExpertAdvisor.idFor(command.getTenantId(), command.getExpertAdvisorId()),
				ea -> ea.changeStatus(command.getStatus(), command.getReason(), clock.instant()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("ExpertAdvisor", command.getTenantId(),
								command.getExpertAdvisorId())));
		log.info(">>> [ExpertAdvisor] 租戶 {} 的 {} 狀態變更為 {} (by {})", command.getTenantId(),
				command.getExpertAdvisorId(), command.getStatus(), command.getRequestedBy());
		return result;
	}

	@Override
	public Optional<ExpertAdvisorReadModel> currentResult(UpdateExpertAdvisorStatusCommand command) {
		return readModels.get(command.getTenantId(), command.getExpertAdvisorId());
	}
}
