package com.kopitra.admin.application.domain.shared;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.UUID;

/**
 * 由業務鍵推導穩定的聚合識別碼
 *
 * <p>
 * 同一組 (scope, businessKey) 永遠得到同一個識別碼，例如 {@code expertadvisor-3f2c...}。 UUID 取自
 * {@code scope:businessKey} 的 SHA-1 摘要 (name-based, version 5)。
 * </p>
 */
public final class DeterministicIds {

	private DeterministicIds() {
	}

	/**
	 * @param scope       識別碼前綴，同時區隔不同聚合
	 * @param businessKey 業務鍵，前後空白會被移除且不分大小寫
	 * @return {@code scope-uuid}
	 */
	public static String derive(String scope, String businessKey) {
		if (scope == null || scope.isBlank()) {
			throw new IllegalArgumentException("scope 不可為空");
		}
		if (businessKey == null || businessKey.isBlank()) {
			throw new IllegalArgumentException("businessKey 不可為空");
		}
		String normalizedScope = scope.trim().toLowerCase(Locale.ROOT);
		String normalizedKey = businessKey.trim().toLowerCase(Locale.ROOT);
		return normalizedScope + "-" + nameBasedUuid(normalizedScope + ":" + normalizedKey);
	}

	/**
	 * 以租戶區隔的識別碼
	 */
	public static String derive(String scope, String tenantId, String businessId) {
		return derive(scope, tenantId + "/" + businessId);
	}

	private static UUID nameBasedUuid(String name) {
		byte[] hash;
		try {
			hash = MessageDigest.getInstance("SHA-1").digest(name.getBytes(StandardCharsets.UTF_8));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("JVM 不支援 SHA-1", e);
		}
		hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
		hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);
		ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
		return new UUID(buffer.getLong(), buffer.getLong());
	}
}
