package com.kopitra.admin.infra.event.codec;

import com.kopitra.admin.application.domain.shared.EventEnvelope;

import tools.jackson.databind.ObjectMapper;

/**
 * 事件信封 JSON 編解碼器
 *
 * <p>
 * 事件本體以 {@code @type} 欄位記錄類型標籤，解碼時依標籤還原為原本的事件類別。標籤需事先註冊於 ObjectMapper
 * (見 {@link ManagementEventTypes})。編解碼失敗均視為系統錯誤。
 * </p>
 */
public class EventEnvelopeCodec {

	private final ObjectMapper objectMapper;

	public EventEnvelopeCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將事件信封序列化為 JSON byte[]
	 */
	public byte[] serialize(EventEnvelope envelope) {
		try {
			return objectMapper.writeValueAsBytes(envelope);
		} catch (Exception e) {
			throw new IllegalStateException(envelope.streamId() + "@" + envelope.version() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 反序列化回事件信封
	 */
	public EventEnvelope deserialize(byte[] data) {
		try {
			return objectMapper.readValue(data, EventEnvelope.class);
		} catch (Exception e) {
			throw new IllegalStateException("EventEnvelope JSON 反序列化失敗", e);
		}
	}
}
