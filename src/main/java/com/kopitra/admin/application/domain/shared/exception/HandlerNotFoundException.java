package com.kopitra.admin.application.domain.shared.exception;

/**
 * 指令或查詢找不到對應的 Handler，屬於組態錯誤
 */
public class HandlerNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public HandlerNotFoundException(Class<?> messageType) {
		super("找不到 " + messageType.getSimpleName() + " 的 Handler");
	}
}
