package com.kopitra.admin.application.domain.shared.exception;

import lombok.Getter;

/**
 * 樂觀鎖衝突：寫入時事件流的最新版本與預期版本不符。
 * <p>
 * 屬於可恢復錯誤，呼叫端可重新載入後重試。
 * </p>
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String streamId;
	private final long expectedVersion;
	private final long actualVersion;

	public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
		super("事件流 " + streamId + " 版本衝突，預期版本 " + expectedVersion + "，實際版本 " + actualVersion);
		this.streamId = streamId;
		this.expectedVersion = expectedVersion;
		this.actualVersion = actualVersion;
	}
}
