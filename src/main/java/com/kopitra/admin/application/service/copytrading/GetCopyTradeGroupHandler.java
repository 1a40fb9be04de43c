package com.kopitra.admin.application.service.copytrading;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.copytrading.query.GetCopyTradeGroupQuery;
import com.kopitra.admin.application.port.CopyTradeGroupReadModelPort;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class GetCopyTradeGroupHandler
		implements QueryHandler<GetCopyTradeGroupQuery, Optional<CopyTradeGroupReadModel>> {

	private final CopyTradeGroupReadModelPort readModels;

	@Override
	public Class<GetCopyTradeGroupQuery> queryType() {
		return GetCopyTradeGroupQuery.class;
	}

	@Override
	public Optional<CopyTradeGroupReadModel> handle(GetCopyTradeGroupQuery query) {
		return readModels.get(query.tenantId(), query.groupId());
	}
}
