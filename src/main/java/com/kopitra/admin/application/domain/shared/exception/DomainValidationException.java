package com.kopitra.admin.application.domain.shared.exception;

/**
 * 業務規則或指令內容驗證失敗，於事件產生前拋出
 */
public class DomainValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DomainValidationException(String message) {
		super(message);
	}
}
