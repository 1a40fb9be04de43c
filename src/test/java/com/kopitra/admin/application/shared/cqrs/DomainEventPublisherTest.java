package com.kopitra.admin.application.shared.cqrs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupCreated;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberRemoved;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.PublishFailureException;

/**
 * <h1>事件發布器測試</h1>
 *
 * <pre>
 * <b>Given</b> 依序註冊的多個 Handler
 * <b>When</b>  發布一批事件
 * <b>Then</b>  事件依版本、Handler 依註冊順序執行，失敗時中止並帶出失敗的事件
 * </pre>
 */
class DomainEventPublisherTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private final List<String> calls = new ArrayList<>();

	@Test
	@DisplayName("依事件版本與 Handler 註冊順序同步呼叫")
	void publishesInOrder() {
		DomainEventPublisher publisher = new DomainEventPublisher(
				List.of(new Recording("projection", true), new Recording("messaging", false)));

		publisher.publish(List.of(created(0), removed(1)));

		assertThat(calls).containsExactly("projection@0", "messaging@0", "projection@1", "messaging@1");
	}

	@Test
	void unsubscribedEventsAreIgnored() {
		DomainEventPublisher publisher = new DomainEventPublisher(List.of(new Recording("projection", true) {
			@Override
			public Set<Class<? extends DomainEvent>> subscribedEvents() {
				return Set.of(CopyTradeGroupCreated.class);
			}
		}));

		publisher.publish(List.of(created(0), removed(1)));

		assertThat(calls).containsExactly("projection@0");
	}

	@Test
	@DisplayName("Handler 失敗時停止發布後續事件並帶出失敗位置")
	void failureStopsPublishing() {
		Recording failing = new Recording("failing", false) {
			@Override
			public void handle(EventEnvelope envelope) {
				super.handle(envelope);
				if (envelope.version() == 0) {
					throw new IllegalStateException("boom");
				}
			}
		};
		DomainEventPublisher publisher = new DomainEventPublisher(
				List.of(failing, new Recording("after", true)));
		List<EventEnvelope> batch = List.of(created(0), removed(1));

		assertThatThrownBy(() -> publisher.publish(batch)).isInstanceOfSatisfying(PublishFailureException.class,
				e -> {
					assertThat(e.getFailedEnvelope().version()).isZero();
					assertThat(e.getCommittedEnvelopes()).hasSize(2);
					assertThat(e.getCause()).hasMessage("boom");
				});
		assertThat(calls).containsExactly("failing@0");
	}

	@Test
	@DisplayName("重播只送往可重播的 Handler")
	void replaySkipsNonReplayableHandlers() {
		DomainEventPublisher publisher = new DomainEventPublisher(
				List.of(new Recording("projection", true), new Recording("messaging", false)));

		publisher.replay(created(0));

		assertThat(calls).containsExactly("projection@0");
	}

	private static EventEnvelope created(long version) {
		return new EventEnvelope("g1", "CopyTradeGroup", version,
				new CopyTradeGroupCreated("t1", "g1", "Alpha", null, "ops", NOW), NOW, Map.of());
	}

	private static EventEnvelope removed(long version) {
		return new EventEnvelope("g1", "CopyTradeGroup", version,
				new CopyTradeGroupMemberRemoved("t1", "g1", "m1", NOW, "ops"), NOW, Map.of());
	}

	private class Recording implements DomainEventHandler {

		private final String name;
		private final boolean replayable;

		Recording(String name, boolean replayable) {
			this.name = name;
			this.replayable = replayable;
		}

		@Override
		public Set<Class<? extends DomainEvent>> subscribedEvents() {
			return Set.of(CopyTradeGroupCreated.class, CopyTradeGroupMemberRemoved.class);
		}

		@Override
		public void handle(EventEnvelope envelope) {
			calls.add(name + "@" + envelope.version());
		}

		@Override
		public boolean replayable() {
			return replayable;
		}
	}
}
