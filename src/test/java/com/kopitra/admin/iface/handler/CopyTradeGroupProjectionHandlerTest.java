package com.kopitra.admin.iface.handler;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.copytrading.aggregate.CopyTradeGroup;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel.Member;
import com.kopitra.admin.infra.adapter.CopyTradeGroupReadModelAdapter;
import com.kopitra.admin.infra.adapter.InMemoryMessageBusAdapter;
import com.kopitra.admin.support.CqrsFixture;

/**
 * <h1>跟單群組投影測試</h1>
 *
 * <pre>
 * <b>Given</b> 一個已建立的跟單群組
 * <b>When</b>  依任意順序加入、更新與移除成員
 * <b>Then</b>  讀取模型的成員清單依 memberId 排序，並同步送出成員異動訊息
 * </pre>
 */
class CopyTradeGroupProjectionHandlerTest {

	private static final String GROUP_ID = CopyTradeGroup.idFor("t1", "g1");

	private final CopyTradeGroupReadModelAdapter readModels = new CopyTradeGroupReadModelAdapter();
	private final InMemoryMessageBusAdapter messageBus = new InMemoryMessageBusAdapter();
	private final CqrsFixture fixture = new CqrsFixture(new CopyTradeGroupProjectionHandler(readModels),
			new CopyTradeMemberMessagingHandler(messageBus));

	@Test
	@DisplayName("成員依 memberId 排序，更新時覆蓋原資料")
	void membersAreSortedById() {
		Instant createdAt = fixture.clock.instant();
		fixture.aggregateStore.update(CopyTradeGroup::new, GROUP_ID,
				g -> g.create("t1", "g1", "Alpha", "Scalping desk", "ops", createdAt));
		upsert("m2", CopyTradeMemberRole.FOLLOWER, "0.5");
		upsert("m1", CopyTradeMemberRole.LEADER, "1");
		fixture.clock.advance(Duration.ofMinutes(5));
		upsert("m2", CopyTradeMemberRole.FOLLOWER, "0.75");

		CopyTradeGroupReadModel group = readModels.get("t1", "g1").orElseThrow();
		assertThat(group.createdAt()).isEqualTo(createdAt);
		assertThat(group.members()).extracting(Member::memberId).containsExactly("m1", "m2");
		assertThat(group.members().get(1).allocation()).isEqualByComparingTo("0.75");
		assertThat(group.members().get(1).updatedAt()).isEqualTo(createdAt.plus(Duration.ofMinutes(5)));
	}

	@Test
	void removedMemberDisappears() {
		fixture.aggregateStore.update(CopyTradeGroup::new, GROUP_ID,
				g -> g.create("t1", "g1", "Alpha", null, "ops", fixture.clock.instant()));
		upsert("m1", CopyTradeMemberRole.LEADER, "1");
		upsert("m2", CopyTradeMemberRole.FOLLOWER, "0.5");
		messageBus.drain();

		fixture.aggregateStore.update(CopyTradeGroup::new, GROUP_ID,
				g -> g.removeMember("m1", fixture.clock.instant(), "ops"));

		assertThat(readModels.get("t1", "g1").orElseThrow().members()).extracting(Member::memberId)
				.containsExactly("m2");
		assertThat(messageBus.drain()).singleElement().satisfies(m -> {
			assertThat(m.topic()).isEqualTo(CopyTradeMemberMessagingHandler.TOPIC);
			assertThat(m.message().businessId()).isEqualTo("g1");
			assertThat(m.message().attributes()).containsEntry("memberId", "m1");
		});
	}

	@Test
	@DisplayName("重建時清空讀取模型後可由事件還原")
	void resetThenReplayRestoresGroup() {
		fixture.aggregateStore.update(CopyTradeGroup::new, GROUP_ID,
				g -> g.create("t1", "g1", "Alpha", null, "ops", fixture.clock.instant()));
		upsert("m1", CopyTradeMemberRole.LEADER, "1");
		CopyTradeGroupReadModel before = readModels.get("t1", "g1").orElseThrow();
		messageBus.drain();

		fixture.publisher.getHandlers().forEach(DomainEventHandler::reset);
		assertThat(readModels.list("t1")).isEmpty();
		fixture.eventStore.loadAll().forEach(fixture.publisher::replay);

		assertThat(readModels.get("t1", "g1")).contains(before);
		assertThat(messageBus.drain()).isEmpty();
	}

	private void upsert(String memberId, CopyTradeMemberRole role, String allocation) {
		fixture.aggregateStore.update(CopyTradeGroup::new, GROUP_ID, g -> g.upsertMember(memberId, role,
				RiskStrategy.BALANCED, new BigDecimal(allocation), fixture.clock.instant(), "ops"));
	}
}
