package com.kopitra.admin.application.shared.cqrs;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.kopitra.admin.application.domain.shared.exception.HandlerNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * 查詢分派器，依查詢的具體類型找到唯一的 {@link QueryHandler}
 * <p>
 * 查詢與讀取模型重建互斥，不會讀到重建到一半的資料。
 * </p>
 */
@Slf4j
public class QueryDispatcher {

	private final Map<Class<?>, QueryHandler<?, ?>> handlers;
	private final DomainEventPublisher publisher;

	public QueryDispatcher(List<? extends QueryHandler<?, ?>> queryHandlers, DomainEventPublisher publisher) {
		Map<Class<?>, QueryHandler<?, ?>> registry = new HashMap<>();
		for (QueryHandler<?, ?> handler : queryHandlers) {
			QueryHandler<?, ?> previous = registry.putIfAbsent(handler.queryType(), handler);
			if (previous != null) {
				throw new IllegalStateException("查詢 " + handler.queryType().getSimpleName() + " 重複註冊: "
						+ previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
			}
		}
		this.handlers = Collections.unmodifiableMap(registry);
		this.publisher = publisher;
		log.info(">>> [CQRS] 已註冊 {} 個查詢處理器", handlers.size());
	}

	@SuppressWarnings("unchecked")
	public <R> R dispatch(Query<R> query) {
		Objects.requireNonNull(query, "query 不可為空");
		QueryHandler<Query<R>, R> handler = (QueryHandler<Query<R>, R>) handlers.get(query.getClass());
		if (handler == null) {
			throw new HandlerNotFoundException(query.getClass());
		}
		return publisher.withReadModelsStable(() -> handler.handle(query));
	}
}
