package com.kopitra.admin.application.shared.cqrs;

/**
 * 查詢：直接讀取讀取模型，不經過聚合
 *
 * @param <R> 查詢結果類型
 */
public interface Query<R> {

	String tenantId();
}
