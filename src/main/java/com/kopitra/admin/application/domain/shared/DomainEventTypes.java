package com.kopitra.admin.application.domain.shared;

import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 事件類型標籤工具
 */
public final class DomainEventTypes {

	private DomainEventTypes() {
	}

	/**
	 * 取得事件的類型標籤，優先使用 {@link JsonTypeName}，否則以類別名稱代替
	 */
	public static String tagOf(Class<? extends DomainEvent> eventClass) {
		JsonTypeName typeName = eventClass.getAnnotation(JsonTypeName.class);
		return typeName != null ? typeName.value() : eventClass.getSimpleName();
	}

	public static String tagOf(DomainEvent event) {
		return tagOf(event.getClass());
	}
}
