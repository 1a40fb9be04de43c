package com.kopitra.admin.application.port;

import java.util.List;
import java.util.Optional;

import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;

/**
 * 跟單群組讀取模型 Port
 */
public interface CopyTradeGroupReadModelPort {

	Optional<CopyTradeGroupReadModel> get(String tenantId, String groupId);

	List<CopyTradeGroupReadModel> list(String tenantId);

	void upsert(CopyTradeGroupReadModel model);

	void remove(String tenantId, String groupId);

	void clear();
}
