package com.kopitra.admin.application.domain.adminuser.event;

import com.kopitra.admin.application.domain.shared.DomainEvent;

/**
 * AdminUser 聚合的事件
 */
public sealed interface AdminUserEvent extends DomainEvent
		permits AdminUserProvisioned, AdminUserRolesUpdated, AdminUserNotificationSettingsUpdated {

	String tenantId();

	String userId();
}
