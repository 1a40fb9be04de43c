package com.kopitra.admin.application.domain.copytrading.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("copy-trade-group-created")
public record CopyTradeGroupCreated(String tenantId, String groupId, String name, String description,
		String createdBy, Instant createdAt) implements CopyTradeGroupEvent {
}
