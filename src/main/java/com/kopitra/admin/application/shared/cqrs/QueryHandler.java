package com.kopitra.admin.application.shared.cqrs;

/**
 * 查詢處理器，每種查詢類型只能有一個
 *
 * @param <Q> 查詢類型
 * @param <R> 回傳類型
 */
public interface QueryHandler<Q extends Query<R>, R> {

	Class<Q> queryType();

	R handle(Q query);
}
