package com.kopitra.admin.application.service.copytrading;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.copytrading.aggregate.CopyTradeGroup;
import com.kopitra.admin.application.domain.copytrading.command.CreateCopyTradeGroupCommand;
import com.kopitra.admin.application.domain.shared.exception.ReadModelMissingException;
import com.kopitra.admin.application.port.CopyTradeGroupReadModelPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreateCopyTradeGroupHandler implements CommandHandler<CreateCopyTradeGroupCommand, CopyTradeGroupReadModel> {

	private final AggregateStore aggregateStore;
	private final CopyTradeGroupReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<CreateCopyTradeGroupCommand> commandType() {
		return CreateCopyTradeGroupCommand.class;
	}

	@Override
	public CopyTradeGroupReadModel handle(CreateCopyTradeGroupCommand command) {
		CopyTradeGroupReadModel result = aggregateStore.updateThenRead(CopyTradeGroup::new,
				CopyTradeGroup.idFor(command.getTenantId(), command.getGroupId()),
				group -> group.create(command.getTenantId(), command.getGroupId(), command.getName(),
						command.getDescription(), command.getRequestedBy(), clock.instant()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("CopyTradeGroup", command.getTenantId(),
								command.getGroupId())));
		log.info(">>> [CopyTrade] 租戶 {} 建立跟單群組 {} ({})", command.getTenantId(), command.getGroupId(),
				command.getName());
		return result;
	}

	@Override
	public Optional<CopyTradeGroupReadModel> currentResult(CreateCopyTradeGroupCommand command) {
		return readModels.get(command.getTenantId(), command.getGroupId());
	}
}
