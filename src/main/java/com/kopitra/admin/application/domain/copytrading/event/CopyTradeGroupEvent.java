package com.kopitra.admin.application.domain.copytrading.event;

import com.kopitra.admin.application.domain.shared.DomainEvent;

/**
 * CopyTradeGroup 聚合的事件
 */
public sealed interface CopyTradeGroupEvent extends DomainEvent
		permits CopyTradeGroupCreated, CopyTradeGroupMemberUpserted, CopyTradeGroupMemberRemoved {

	String tenantId();

	String groupId();
}
