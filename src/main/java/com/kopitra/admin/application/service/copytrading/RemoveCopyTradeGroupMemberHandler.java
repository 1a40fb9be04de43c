package com.kopitra.admin.application.service.copytrading;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.copytrading.aggregate.CopyTradeGroup;
import com.kopitra.admin.application.domain.copytrading.command.RemoveCopyTradeGroupMemberCommand;
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
public class RemoveCopyTradeGroupMemberHandler implements CommandHandler<RemoveCopyTradeGroupMemberCommand, CopyTradeGroupReadModel> {

	private final AggregateStore aggregateStore;
	private final CopyTradeGroupReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<RemoveCopyTradeGroupMemberCommand> commandType() {
		return RemoveCopyTradeGroupMemberCommand.class;
	}

	@Override
	public CopyTradeGroupReadModel handle(RemoveCopyTradeGroupMemberCommand command) {
		CopyTradeGroupReadModel result = aggregateStore.updateThenRead(CopyTradeGroup::new,
				CopyTradeGroup.idFor(command.getTenantId(), command.getGroupId()),
				group -> group.removeMember(command.getMemberId(), clock.instant(), command.getRequestedBy()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("CopyTradeGroup", command.getTenantId(),
								command.getGroupId())));
		log.info(">>> [CopyTrade] 群組 {} 移除成員 {}", command.getGroupId(), command.getMemberId());
		return result;
	}

	@Override
	public Optional<CopyTradeGroupReadModel> currentResult(RemoveCopyTradeGroupMemberCommand command) {
		return readModels.get(command.getTenantId(), command.getGroupId());
	}
}
