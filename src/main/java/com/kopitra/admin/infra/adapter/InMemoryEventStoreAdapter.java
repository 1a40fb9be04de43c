package com.kopitra.admin.infra.adapter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.DomainEventTypes;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.ConcurrencyConflictException;
import com.kopitra.admin.application.port.EventStorePort;
import com.kopitra.admin.infra.event.codec.EventEnvelopeCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>記憶體事件儲存 (In-Memory Event Store)</h1>
 * <p>
 * <b>職責：</b> 以 {@code 類型-識別碼} 為事件流名稱保存已序列化的事件信封。
 * </p>
 *
 * <ul>
 * <li><b>樂觀鎖</b>：每個事件流各自加鎖，版本檢查與寫入在同一個臨界區內完成，不同事件流互不阻塞。</li>
 * <li><b>原子可見</b>：整批事件先完成編碼，再一次加入事件流，讀取端不會看到半批資料。</li>
 * <li><b>全域順序</b>：寫入的同時記錄至全域日誌，供讀取模型重建依提交順序重播。</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryEventStoreAdapter implements EventStorePort {

	private static final String EVENT_TYPE_KEY = "eventType";

	private final EventEnvelopeCodec codec;
	private final Clock clock;

	private final Map<String, List<byte[]>> streams = new ConcurrentHashMap<>();
	private final List<byte[]> globalLog = new ArrayList<>();

	@Override
	public List<EventEnvelope> append(String aggregateType, String aggregateId, long expectedVersion,
			List<? extends DomainEvent> events, Map<String, String> metadata) {
		String streamId = aggregateType + "-" + aggregateId;
		if (events.isEmpty()) {
			return List.of();
		}

		List<byte[]> stream = streams.computeIfAbsent(streamId, k -> new ArrayList<>());
		synchronized (stream) {
			long actualVersion = stream.size() - 1L;
			if (actualVersion != expectedVersion) {
				log.debug(">>> [EventStore] {} 版本衝突: expected={}, actual={}", streamId, expectedVersion,
						actualVersion);
				throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
			}

			Instant now = clock.instant();
			List<EventEnvelope> envelopes = new ArrayList<>(events.size());
			List<byte[]> encoded = new ArrayList<>(events.size());
			long version = expectedVersion;
			for (DomainEvent event : events) {
				Map<String, String> eventMetadata = new HashMap<>(metadata);
				eventMetadata.put(EVENT_TYPE_KEY, DomainEventTypes.tagOf(event));
				EventEnvelope envelope = new EventEnvelope(aggregateId, aggregateType, ++version, event, now,
						eventMetadata);
				encoded.add(codec.serialize(envelope));
				envelopes.add(envelope);
			}

			stream.addAll(encoded);
			synchronized (globalLog) {
				globalLog.addAll(encoded);
			}
			return List.copyOf(envelopes);
		}
	}

	@Override
	public List<EventEnvelope> load(String aggregateType, String aggregateId) {
		List<byte[]> stream = streams.get(aggregateType + "-" + aggregateId);
		if (stream == null) {
			return List.of();
		}
		List<byte[]> snapshot;
		synchronized (stream) {
			snapshot = new ArrayList<>(stream);
		}
		return decode(snapshot);
	}

	@Override
	public List<EventEnvelope> loadAll() {
		List<byte[]> snapshot;
		synchronized (globalLog) {
			snapshot = new ArrayList<>(globalLog);
		}
		return decode(snapshot);
	}

	private List<EventEnvelope> decode(List<byte[]> records) {
		List<EventEnvelope> envelopes = new ArrayList<>(records.size());
		for (byte[] data : records) {
			envelopes.add(codec.deserialize(data));
		}
		return envelopes;
	}
}
