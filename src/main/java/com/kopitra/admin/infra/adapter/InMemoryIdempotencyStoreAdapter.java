package com.kopitra.admin.infra.adapter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.shared.exception.IdempotencyKeyReusedException;
import com.kopitra.admin.application.port.IdempotencyStorePort;
import com.kopitra.admin.application.shared.dto.IdempotencyResult;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>記憶體冪等鍵儲存</h1>
 * <p>
 * 以 {@link ConcurrentHashMap#compute} 對單一 (tenantId, key) 做原子判斷與佔位，多個執行緒同時送出相同的鍵時只有一個會拿到
 * isNew=true。到期的紀錄視同不存在。
 * </p>
 */
@Slf4j
@Component
public class InMemoryIdempotencyStoreAdapter implements IdempotencyStorePort {

	private final Map<ScopedKey, Entry> entries = new ConcurrentHashMap<>();
	private final Clock clock;
	private final Duration ttl;

	public InMemoryIdempotencyStoreAdapter(Clock clock, @Value("${kopitra.idempotency.ttl:PT24H}") Duration ttl) {
		this.clock = clock;
		this.ttl = ttl;
	}

	@Override
	public IdempotencyResult tryStore(String tenantId, String idempotencyKey, String payloadHash) {
		Instant now = clock.instant();
		ScopedKey key = new ScopedKey(tenantId, idempotencyKey);
		boolean[] created = new boolean[1];
		Entry entry = entries.compute(key, (k, existing) -> {
			if (existing == null || existing.expired(now)) {
				created[0] = true;
				return new Entry(payloadHash, null, false, now, expiry(now));
			}
			return existing;
		});

		if (created[0]) {
			return IdempotencyResult.NEW;
		}
		if (!entry.payloadHash().equals(payloadHash)) {
			log.warn(">>> [Idempotency] 租戶 {} 的冪等鍵 {} 被用於不同內容", tenantId, idempotencyKey);
			throw new IdempotencyKeyReusedException(tenantId, idempotencyKey);
		}
		return IdempotencyResult.DUPLICATE;
	}

	@Override
	public void saveResponse(String tenantId, String idempotencyKey, Object response) {
		entries.computeIfPresent(new ScopedKey(tenantId, idempotencyKey),
				(k, existing) -> new Entry(existing.payloadHash(), response, existing.committed(), existing.createdAt(),
						existing.expiresAt()));
	}

	@Override
	public void markCommitted(String tenantId, String idempotencyKey) {
		entries.computeIfPresent(new ScopedKey(tenantId, idempotencyKey),
				(k, existing) -> new Entry(existing.payloadHash(), existing.response(), true, existing.createdAt(),
						existing.expiresAt()));
	}

	@Override
	public boolean isCommitted(String tenantId, String idempotencyKey) {
		Entry entry = entries.get(new ScopedKey(tenantId, idempotencyKey));
		return entry != null && !entry.expired(clock.instant()) && entry.committed();
	}

	@Override
	public Optional<Object> findResponse(String tenantId, String idempotencyKey) {
		Entry entry = entries.get(new ScopedKey(tenantId, idempotencyKey));
		if (entry == null || entry.expired(clock.instant())) {
			return Optional.empty();
		}
		return Optional.ofNullable(entry.response());
	}

	@Override
	public void release(String tenantId, String idempotencyKey) {
		entries.remove(new ScopedKey(tenantId, idempotencyKey));
	}

	@Override
	public int deleteExpired(Instant now) {
		int[] removed = new int[1];
		entries.entrySet().removeIf(e -> {
			if (e.getValue().expired(now)) {
				removed[0]++;
				return true;
			}
			return false;
		});
		return removed[0];
	}

	private Instant expiry(Instant now) {
		return ttl.isZero() || ttl.isNegative() ? null : now.plus(ttl);
	}

	private record ScopedKey(String tenantId, String idempotencyKey) {
	}

	/**
	 * @param expiresAt null 代表永不過期
	 */
	private record Entry(String payloadHash, Object response, boolean committed, Instant createdAt,
			Instant expiresAt) {

		boolean expired(Instant now) {
			return expiresAt != null && !now.isBefore(expiresAt);
		}
	}
}
