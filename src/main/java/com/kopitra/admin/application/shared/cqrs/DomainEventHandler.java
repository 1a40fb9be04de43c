package com.kopitra.admin.application.shared.cqrs;

import java.util.Set;

import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;

/**
 * 領域事件處理器
 *
 * <p>
 * 由 {@link DomainEventPublisher} 依事件的具體類型同步呼叫。讀取模型投影應宣告為可重播，以便讀取模型重建時重新套用事件；
 * 對外發送訊息的處理器則不可重播。
 * </p>
 */
public interface DomainEventHandler {

	/**
	 * 訂閱的事件類型
	 */
	Set<Class<? extends DomainEvent>> subscribedEvents();

	void handle(EventEnvelope envelope);

	/**
	 * 是否參與讀取模型重建
	 */
	default boolean replayable() {
		return false;
	}

	/**
	 * 重建前清空自身維護的狀態
	 */
	default void reset() {
	}
}
