package com.kopitra.admin.application.domain.copytrading.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("copy-trade-member-removed")
public record CopyTradeGroupMemberRemoved(String tenantId, String groupId, String memberId, Instant removedAt,
		String removedBy) implements CopyTradeGroupEvent {
}
