package com.kopitra.admin.application.service.expertadvisor;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.ExpertAdvisor;
import com.kopitra.admin.application.domain.expertadvisor.command.RegisterExpertAdvisorCommand;
import com.kopitra.admin.application.domain.shared.exception.ReadModelMissingException;
import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 註冊 Expert Advisor，註冊後即進入待審核
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterExpertAdvisorHandler
		implements CommandHandler<RegisterExpertAdvisorCommand, ExpertAdvisorReadModel> {

	private final AggregateStore aggregateStore;
	private final ExpertAdvisorReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<RegisterExpertAdvisorCommand> commandType() {
		return RegisterExpertAdvisorCommand.class;
	}

	@Override
	public ExpertAdvisorReadModel handle(RegisterExpertAdvisorCommand command) {
		ExpertAdvisorReadModel result = aggregateStore.updateThenRead(ExpertAdvisor::new,
				ExpertAdvisor.idFor(command.getTenantId(), command.getExpertAdvisorId()),
				ea -> ea.register(command.getTenantId(), command.getExpertAdvisorId(), command.getDisplayName(),
						command.getDescription(), command.getRequestedBy(), clock.instant()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("ExpertAdvisor", command.getTenantId(),
								command.getExpertAdvisorId())));
		log.info(">>> [ExpertAdvisor] 租戶 {} 註冊 {} ({})", command.getTenantId(), command.getExpertAdvisorId(),
				command.getDisplayName());
		return result;
	}

	@Override
	public Optional<ExpertAdvisorReadModel> currentResult(RegisterExpertAdvisorCommand command) {
		return readModels.get(command.getTenantId(), command.getExpertAdvisorId());
	}
}
