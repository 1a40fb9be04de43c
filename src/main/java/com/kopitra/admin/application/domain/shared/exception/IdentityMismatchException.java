package com.kopitra.admin.application.domain.shared.exception;

/**
 * 重播歷史時，事件所屬的聚合與目前聚合不一致
 */
public class IdentityMismatchException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public IdentityMismatchException(String expected, String actual) {
		super("事件屬於聚合 " + actual + "，無法套用至聚合 " + expected);
	}
}
