package com.kopitra.admin.application.domain.adminuser.event;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("admin-user-notification-settings-updated")
public record AdminUserNotificationSettingsUpdated(String tenantId, String userId, boolean emailEnabled,
		List<String> topics, Instant updatedAt, String updatedBy) implements AdminUserEvent {

	public AdminUserNotificationSettingsUpdated {
		topics = List.copyOf(topics);
	}
}
