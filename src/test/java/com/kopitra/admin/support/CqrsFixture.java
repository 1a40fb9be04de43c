package com.kopitra.admin.support;

import java.time.Instant;
import java.util.List;

import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.cqrs.DomainEventPublisher;
import com.kopitra.admin.config.config.EventCodecConfiguration;
import com.kopitra.admin.infra.adapter.InMemoryEventStoreAdapter;
import com.kopitra.admin.infra.adapter.InMemoryPublishFailureLogAdapter;

/**
 * 不啟動 Spring 的 CQRS 核心組裝，供單元測試使用
 */
public class CqrsFixture {

	public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
	public final InMemoryEventStoreAdapter eventStore = new InMemoryEventStoreAdapter(
			new EventCodecConfiguration().eventEnvelopeCodec(), clock);
	public final InMemoryPublishFailureLogAdapter failureLog = new InMemoryPublishFailureLogAdapter();
	public final DomainEventPublisher publisher;
	public final AggregateStore aggregateStore;

	public CqrsFixture(DomainEventHandler... handlers) {
		this.publisher = new DomainEventPublisher(List.of(handlers));
		this.aggregateStore = new AggregateStore(eventStore, publisher, failureLog, clock);
	}
}
