package com.kopitra.admin.application.port;

import java.time.Instant;
import java.util.Optional;

import com.kopitra.admin.application.domain.shared.exception.IdempotencyKeyReusedException;
import com.kopitra.admin.application.shared.dto.IdempotencyResult;

/**
 * <h1>冪等鍵儲存 Port</h1>
 * <p>
 * 以 (tenantId, idempotencyKey) 為範圍記錄請求內容雜湊，確保重送的請求至多被執行一次。
 * </p>
 */
public interface IdempotencyStorePort {

	/**
	 * 原子地佔用冪等鍵
	 *
	 * @return isNew=true 代表首次出現，呼叫端應執行指令；false 代表相同內容的重送
	 * @throws IdempotencyKeyReusedException 同一鍵對應到不同的內容雜湊
	 */
	IdempotencyResult tryStore(String tenantId, String idempotencyKey, String payloadHash);

	/**
	 * 保存指令結果，供重送時直接回傳
	 */
	void saveResponse(String tenantId, String idempotencyKey, Object response);

	Optional<Object> findResponse(String tenantId, String idempotencyKey);

	/**
	 * 標記指令的事件已寫入 (但沒有可保存的回應)，之後不可再釋放重跑
	 */
	void markCommitted(String tenantId, String idempotencyKey);

	boolean isCommitted(String tenantId, String idempotencyKey);

	/**
	 * 釋放冪等鍵，用於指令執行失敗後允許重試
	 */
	void release(String tenantId, String idempotencyKey);

	/**
	 * 刪除到期的紀錄
	 *
	 * @return 刪除筆數
	 */
	int deleteExpired(Instant now);
}
