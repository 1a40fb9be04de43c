package com.kopitra.admin.application.domain.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.kopitra.admin.application.domain.shared.exception.IdentityMismatchException;

/**
 * <h1>事件溯源聚合根 (Event-Sourced Aggregate Root)</h1>
 * <p>
 * <b>職責：</b> 以不可變狀態 {@code S} 表示聚合目前的樣貌，狀態只能由事件推導而來。
 * </p>
 *
 * <ul>
 * <li><b>重播決定性</b>：{@link #apply(Object, DomainEvent)} 必須是純函數，同一段歷史永遠得到同一個狀態。</li>
 * <li><b>識別綁定</b>：聚合識別於建構時固定，重播他人的事件會被拒絕。</li>
 * <li><b>版本追蹤</b>：{@code persistedVersion} 為 -1 代表尚無歷史，寫入時作為樂觀鎖的預期版本。</li>
 * </ul>
 *
 * <p>
 * 業務規則由子類在呼叫 {@link #emit(DomainEvent)} 之前檢查，{@code apply} 僅負責狀態轉移。
 * </p>
 *
 * @param <S> 聚合狀態類型
 * @param <E> 聚合事件類型
 */
public abstract class AggregateRoot<S, E extends DomainEvent> {

	private final String id;
	private S state;
	private long persistedVersion = -1;
	private final List<E> uncommittedEvents = new ArrayList<>();

	protected AggregateRoot(String id, S initialState) {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("聚合識別碼不可為空");
		}
		this.id = id;
		this.state = initialState;
	}

	/**
	 * 狀態轉移函數：給定目前狀態與事件，回傳新狀態
	 */
	protected abstract S apply(S state, E event);

	/**
	 * 事件類型，用於判斷重播的事件是否屬於本聚合
	 */
	protected abstract Class<E> eventType();

	/**
	 * 聚合類型名稱，組成事件流名稱 {@code 類型-識別碼}
	 */
	public String aggregateType() {
		return getClass().getSimpleName();
	}

	/**
	 * 套用事件並加入待提交清單
	 */
	protected void emit(E event) {
		this.state = apply(state, event);
		uncommittedEvents.add(event);
	}

	/**
	 * 由歷史事件重建狀態。
	 * <p>
	 * 全部事件先通過識別檢查後才開始套用，任何一筆不符都不會留下部分套用的狀態。
	 * </p>
	 *
	 * @param history 依版本排序的歷史事件
	 * @throws IdentityMismatchException 事件不屬於本聚合
	 */
	public void loadFromHistory(List<EventEnvelope> history) {
		List<E> events = new ArrayList<>(history.size());
		for (EventEnvelope envelope : history) {
			if (!id.equals(envelope.aggregateId()) || !aggregateType().equals(envelope.aggregateType())) {
				throw new IdentityMismatchException(aggregateType() + "-" + id, envelope.streamId());
			}
			if (!eventType().isInstance(envelope.payload())) {
				throw new IdentityMismatchException(aggregateType() + "-" + id,
						envelope.payload().getClass().getSimpleName());
			}
			events.add(eventType().cast(envelope.payload()));
		}

		S replayed = state;
		for (E event : events) {
			replayed = apply(replayed, event);
		}
		this.state = replayed;
		if (!history.isEmpty()) {
			this.persistedVersion = history.get(history.size() - 1).version();
		}
	}

	/**
	 * 清除待提交事件，於成功寫入後由 AggregateStore 呼叫
	 */
	public void markCommitted(long lastVersion) {
		this.persistedVersion = lastVersion;
		uncommittedEvents.clear();
	}

	public String getId() {
		return id;
	}

	public S getState() {
		return state;
	}

	public long getPersistedVersion() {
		return persistedVersion;
	}

	public long getCurrentVersion() {
		return persistedVersion + uncommittedEvents.size();
	}

	public List<E> getUncommittedEvents() {
		return Collections.unmodifiableList(uncommittedEvents);
	}

	/**
	 * 是否已有任何歷史或待提交事件
	 */
	public boolean exists() {
		return getCurrentVersion() >= 0;
	}
}
