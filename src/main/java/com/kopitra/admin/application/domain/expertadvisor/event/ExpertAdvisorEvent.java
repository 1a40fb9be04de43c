package com.kopitra.admin.application.domain.expertadvisor.event;

import com.kopitra.admin.application.domain.shared.DomainEvent;

/**
 * ExpertAdvisor 聚合的事件
 */
public sealed interface ExpertAdvisorEvent extends DomainEvent
		permits ExpertAdvisorRegistered, ExpertAdvisorApproved, ExpertAdvisorStatusChanged {

	String tenantId();

	String expertAdvisorId();
}
