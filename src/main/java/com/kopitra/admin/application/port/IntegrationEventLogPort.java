package com.kopitra.admin.application.port;

import java.util.List;

import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;

/**
 * EA 整合事件紀錄 Port
 */
public interface IntegrationEventLogPort {

	void append(EaIntegrationEvent event);

	/**
	 * 依 occurredAt 由新到舊，同時間者依 receivedAt 由新到舊
	 */
	List<EaIntegrationEvent> list(String tenantId);
}
