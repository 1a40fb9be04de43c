package com.kopitra.admin.infra.event.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.kopitra.admin.application.domain.adminuser.event.AdminUserEvent;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupEvent;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorEvent;
import com.kopitra.admin.application.domain.shared.DomainEvent;

/**
 * 管理後台所有可寫入事件流的事件類型，由各聚合的 sealed 事件介面展開
 */
public final class ManagementEventTypes {

	private static final List<Class<? extends DomainEvent>> ALL = collect(ExpertAdvisorEvent.class,
			CopyTradeGroupEvent.class, AdminUserEvent.class);

	private ManagementEventTypes() {
	}

	public static List<Class<? extends DomainEvent>> all() {
		return ALL;
	}

	@SafeVarargs
	@SuppressWarnings("unchecked")
	private static List<Class<? extends DomainEvent>> collect(Class<? extends DomainEvent>... sealedTypes) {
		List<Class<? extends DomainEvent>> types = new ArrayList<>();
		for (Class<? extends DomainEvent> sealedType : sealedTypes) {
			for (Class<?> permitted : sealedType.getPermittedSubclasses()) {
				types.add((Class<? extends DomainEvent>) permitted);
			}
		}
		return Collections.unmodifiableList(types);
	}
}
