package com.kopitra.admin.application.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.shared.exception.IdempotencyKeyReusedException;
import com.kopitra.admin.application.domain.shared.exception.PublishFailureException;
import com.kopitra.admin.application.port.IdempotencyStorePort;
import com.kopitra.admin.application.port.PublishFailureLogPort;
import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.cqrs.CommandDispatcher;
import com.kopitra.admin.application.shared.cqrs.DomainEventPublisher;
import com.kopitra.admin.application.shared.dto.IdempotencyResult;
import com.kopitra.admin.infra.event.codec.PayloadHasher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>冪等指令執行服務</h1>
 * <p>
 * <b>職責：</b> 保證同一租戶下、同一冪等鍵的指令至多被執行一次。
 * </p>
 *
 * <ul>
 * <li><b>首次請求</b>：佔用冪等鍵後分派指令，並保存回應。</li>
 * <li><b>重送請求</b>：內容雜湊相同時不再執行，直接回傳先前保存的回應。</li>
 * <li><b>內容不符</b>：相同冪等鍵但內容不同時拋出 {@link IdempotencyKeyReusedException}。</li>
 * </ul>
 *
 * <p>
 * 未提供冪等鍵時以 {@code 指令名稱:內容雜湊} 代替。指令在寫入前失敗會釋放冪等鍵讓呼叫端修正後重試；
 * {@link PublishFailureException} 代表事件已寫入，冪等鍵保留並標記為已寫入。
 * </p>
 * <p>
 * 已寫入但沒有保存回應的重送，在讀取模型修復前會被拒絕；修復後改由 Handler 從讀取模型推得結果回應，不再重跑指令。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotentCommandService {

	private final IdempotencyStorePort idempotencyStore;
	private final CommandDispatcher commandDispatcher;
	private final PayloadHasher payloadHasher;
	private final PublishFailureLogPort publishFailureLog;
	private final DomainEventPublisher publisher;

	/**
	 * @param idempotencyKey 呼叫端提供的冪等鍵，可為 null
	 * @param command        指令
	 * @return 指令結果；重送時為首次執行的結果
	 */
	@SuppressWarnings("unchecked")
	public <R> R execute(String idempotencyKey, Command<R> command) {
		String tenantId = command.getTenantId();
		String payloadHash = payloadHasher.hash(command);
		String key = idempotencyKey == null || idempotencyKey.isBlank()
				? command.getClass().getSimpleName() + ":" + payloadHash
				: idempotencyKey;

		IdempotencyResult result = idempotencyStore.tryStore(tenantId, key, payloadHash);
		if (!result.isNew()) {
			log.info(">>> [Idempotency] 租戶 {} 重送請求 {}，略過執行", tenantId, key);
			Optional<Object> cached = idempotencyStore.findResponse(tenantId, key);
			if (cached.isPresent()) {
				return (R) cached.get();
			}
			return recoverCommitted(tenantId, key, command);
		}

		R response;
		try {
			response = commandDispatcher.dispatch(command);
		} catch (PublishFailureException e) {
			idempotencyStore.markCommitted(tenantId, key);
			throw e;
		} catch (RuntimeException e) {
			idempotencyStore.release(tenantId, key);
			throw e;
		}
		idempotencyStore.saveResponse(tenantId, key, response);
		return response;
	}

	private <R> R recoverCommitted(String tenantId, String key, Command<R> command) {
		if (!idempotencyStore.isCommitted(tenantId, key)) {
			throw new IllegalStateException("冪等鍵 " + key + " 的請求仍在處理中");
		}
		if (!publishFailureLog.pending().isEmpty()) {
			throw new IllegalStateException("冪等鍵 " + key + " 的事件已寫入，讀取模型修復中，請稍後重試");
		}

		R response = publisher.withReadModelsStable(() -> commandDispatcher.currentResult(command))
				.orElseThrow(() -> new IllegalStateException("冪等鍵 " + key + " 的事件已寫入，但無法取得先前的結果"));
		idempotencyStore.saveResponse(tenantId, key, response);
		log.info(">>> [Idempotency] 租戶 {} 的冪等鍵 {} 已由讀取模型補回回應", tenantId, key);
		return response;
	}
}
