package com.kopitra.admin.application.domain.shared;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 領域事件標記介面
 *
 * <p>
 * 事件本身不攜帶聚合識別與版本，這些資訊由 {@link EventEnvelope} 負責。各聚合以 sealed 子介面列舉其事件種類，
 * 序列化時以 {@code @type} 欄位作為鑑別值。
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
public interface DomainEvent {
}
