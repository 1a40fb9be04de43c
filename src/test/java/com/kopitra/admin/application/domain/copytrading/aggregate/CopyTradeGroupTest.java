package com.kopitra.admin.application.domain.copytrading.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;

class CopyTradeGroupTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	@Test
	void membersRequireExistingGroup() {
		CopyTradeGroup group = new CopyTradeGroup(CopyTradeGroup.idFor("t1", "g1"));

		assertThatThrownBy(() -> group.upsertMember("m1", CopyTradeMemberRole.LEADER, RiskStrategy.BALANCED,
				BigDecimal.ONE, NOW, "ops")).isInstanceOf(DomainValidationException.class);
	}

	@Test
	void upsertReplacesExistingMember() {
		CopyTradeGroup group = created();

		group.upsertMember("m1", CopyTradeMemberRole.FOLLOWER, RiskStrategy.CONSERVATIVE, new BigDecimal("0.5"), NOW,
				"ops");
		group.upsertMember("m1", CopyTradeMemberRole.FOLLOWER, RiskStrategy.AGGRESSIVE, new BigDecimal("0.8"), NOW,
				"ops");

		assertThat(group.getState().members()).hasSize(1);
		assertThat(group.getState().members().get("m1").riskStrategy()).isEqualTo(RiskStrategy.AGGRESSIVE);
	}

	@Test
	void nonPositiveAllocationIsRejected() {
		CopyTradeGroup group = created();

		assertThatThrownBy(() -> group.upsertMember("m1", CopyTradeMemberRole.FOLLOWER, RiskStrategy.BALANCED,
				BigDecimal.ZERO, NOW, "ops")).isInstanceOf(DomainValidationException.class);
	}

	@Test
	void removingUnknownMemberIsNoOp() {
		CopyTradeGroup group = created();

		group.removeMember("nobody", NOW, "ops");

		assertThat(group.getUncommittedEvents()).hasSize(1);
	}

	@Test
	void createTwiceFails() {
		CopyTradeGroup group = created();

		assertThatThrownBy(() -> group.create("t1", "g1", "again", null, "ops", NOW))
				.isInstanceOf(DomainValidationException.class);
	}

	private static CopyTradeGroup created() {
		CopyTradeGroup group = new CopyTradeGroup(CopyTradeGroup.idFor("t1", "g1"));
		group.create("t1", "g1", "Alpha", "main group", "ops", NOW);
		return group;
	}
}
