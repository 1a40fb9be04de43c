package com.kopitra.admin.application.shared.cqrs;

/**
 * 指令：對單一租戶下某個業務物件提出的變更請求
 *
 * @param <R> Handler 回傳的結果類型
 */
public interface Command<R> {

	String getTenantId();
}
