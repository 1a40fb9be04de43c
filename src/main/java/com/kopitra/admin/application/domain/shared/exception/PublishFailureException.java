package com.kopitra.admin.application.domain.shared.exception;

import java.util.List;

import com.kopitra.admin.application.domain.shared.EventEnvelope;

import lombok.Getter;

/**
 * <h1>事件發布失敗</h1>
 * <p>
 * 事件已成功寫入事件流，但某個 Handler 處理失敗。寫入不會回滾，讀取模型需透過重建補齊。
 * </p>
 */
@Getter
public class PublishFailureException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * 處理失敗的事件
	 */
	private final transient EventEnvelope failedEnvelope;

	/**
	 * 本次已寫入的全部事件
	 */
	private final transient List<EventEnvelope> committedEnvelopes;

	public PublishFailureException(EventEnvelope failedEnvelope, List<EventEnvelope> committedEnvelopes,
			Throwable cause) {
		super("事件 " + failedEnvelope.streamId() + "@" + failedEnvelope.version() + " 發布失敗: " + cause.getMessage(),
				cause);
		this.failedEnvelope = failedEnvelope;
		this.committedEnvelopes = List.copyOf(committedEnvelopes);
	}
}
