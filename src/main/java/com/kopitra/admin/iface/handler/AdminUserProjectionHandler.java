package com.kopitra.admin.iface.handler;

import java.util.List;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.adminuser.event.AdminUserNotificationSettingsUpdated;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserProvisioned;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserRolesUpdated;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.AdminUserReadModelPort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>管理者讀取模型投影</h1>
 * <p>
 * 將 AdminUser 事件投影為 {@link AdminUserReadModel}；找不到既有資料的更新事件會被略過。
 * </p>
 */
@Slf4j
@Order(0)
@Component
@RequiredArgsConstructor
public class AdminUserProjectionHandler implements DomainEventHandler {

	private final AdminUserReadModelPort readModels;

	@Override
	public Set<Class<? extends DomainEvent>> subscribedEvents() {
		return Set.of(AdminUserProvisioned.class, AdminUserRolesUpdated.class,
				AdminUserNotificationSettingsUpdated.class);
	}

	@Override
	public void handle(EventEnvelope envelope) {
		DomainEvent event = envelope.payload();
		if (event instanceof AdminUserProvisioned e) {
			readModels.upsert(new AdminUserReadModel(e.tenantId(), e.userId(), e.email(), e.displayName(),
					e.roles(), false, List.of(), envelope.timestamp()));
		} else if (event instanceof AdminUserRolesUpdated e) {
			readModels.get(e.tenantId(), e.userId()).ifPresentOrElse(
					existing -> readModels.upsert(new AdminUserReadModel(existing.tenantId(), existing.userId(),
							existing.email(), existing.displayName(), e.roles(), existing.emailEnabled(),
							existing.topics(), envelope.timestamp())),
					() -> skip(envelope));
		} else if (event instanceof AdminUserNotificationSettingsUpdated e) {
			readModels.get(e.tenantId(), e.userId()).ifPresentOrElse(
					existing -> readModels.upsert(new AdminUserReadModel(existing.tenantId(), existing.userId(),
							existing.email(), existing.displayName(), existing.roles(), e.emailEnabled(), e.topics(),
							envelope.timestamp())),
					() -> skip(envelope));
		}
	}

	@Override
	public boolean replayable() {
		return true;
	}

	@Override
	public void reset() {
		readModels.clear();
	}

	private void skip(EventEnvelope envelope) {
		log.warn(">>> [Projection] {}@{} 找不到管理者讀取模型，略過", envelope.streamId(), envelope.version());
	}
}
