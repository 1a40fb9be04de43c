package com.kopitra.admin.application.domain.copytrading.query;

import java.util.Optional;

import com.kopitra.admin.application.shared.cqrs.Query;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

public record GetCopyTradeGroupQuery(String tenantId, String groupId)
		implements Query<Optional<CopyTradeGroupReadModel>> {
}
