package com.kopitra.admin.application.domain.shared.exception;

/**
 * 指令成功後找不到對應的讀取模型
 */
public class ReadModelMissingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ReadModelMissingException(String readModel, String tenantId, String businessId) {
		super(readModel + " 讀取模型不存在 (tenant=" + tenantId + ", id=" + businessId + ")");
	}
}
