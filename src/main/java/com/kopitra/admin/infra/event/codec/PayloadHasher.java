package com.kopitra.admin.infra.event.codec;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import tools.jackson.databind.ObjectMapper;

/**
 * 以 SHA-256 計算請求內容的雜湊，作為冪等鍵比對依據
 */
public class PayloadHasher {

	private final ObjectMapper objectMapper;

	public PayloadHasher(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * @param payload 任意可序列化為 JSON 的物件
	 * @return 十六進位小寫雜湊
	 */
	public String hash(Object payload) {
		byte[] json;
		try {
			json = objectMapper.writeValueAsBytes(payload);
		} catch (Exception e) {
			throw new IllegalStateException(payload.getClass().getSimpleName() + " JSON 序列化失敗", e);
		}
		return hash(json);
	}

	public String hash(byte[] data) {
		try {
			return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("JVM 不支援 SHA-256", e);
		}
	}
}
