package com.kopitra.admin.application.domain.shared.exception;

import lombok.Getter;

/**
 * 同一個冪等鍵被用於不同內容的請求
 */
@Getter
public class IdempotencyKeyReusedException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String tenantId;
	private final String idempotencyKey;

	public IdempotencyKeyReusedException(String tenantId, String idempotencyKey) {
		super("租戶 " + tenantId + " 的冪等鍵 " + idempotencyKey + " 已被用於不同的請求內容");
		this.tenantId = tenantId;
		this.idempotencyKey = idempotencyKey;
	}
}
