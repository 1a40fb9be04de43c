package com.kopitra.admin.application.shared.dto;

/**
 * 冪等鍵佔用結果
 *
 * @param isNew 是否為首次出現
 */
public record IdempotencyResult(boolean isNew) {

	public static final IdempotencyResult NEW = new IdempotencyResult(true);
	public static final IdempotencyResult DUPLICATE = new IdempotencyResult(false);
}
