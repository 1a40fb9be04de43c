package com.kopitra.admin.application.domain.expertadvisor.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorApproved;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorRegistered;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorStatusChanged;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;

class ExpertAdvisorTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	@Test
	@DisplayName("註冊產生 Registered 與待審核的 StatusChanged 兩筆事件")
	void registerEmitsTwoEvents() {
		ExpertAdvisor ea = registered();

		assertThat(ea.getUncommittedEvents()).hasSize(2);
		assertThat(ea.getUncommittedEvents().get(0)).isInstanceOf(ExpertAdvisorRegistered.class);
		ExpertAdvisorStatusChanged changed = (ExpertAdvisorStatusChanged) ea.getUncommittedEvents().get(1);
		assertThat(changed.status()).isEqualTo(ExpertAdvisorStatus.PENDING_APPROVAL);
		assertThat(changed.reason()).isEqualTo("Awaiting approval");
		assertThat(ea.getCurrentVersion()).isEqualTo(1);
	}

	@Test
	void approveTwiceIsNoOp() {
		ExpertAdvisor ea = registered();

		ea.approve("reviewer", NOW);
		ea.approve("reviewer", NOW);

		assertThat(ea.getUncommittedEvents()).hasSize(4);
		assertThat(ea.getUncommittedEvents().get(2)).isInstanceOf(ExpertAdvisorApproved.class);
		assertThat(ea.getState().status()).isEqualTo(ExpertAdvisorStatus.APPROVED);
		assertThat(ea.getState().approvedBy()).isEqualTo("reviewer");
	}

	@Test
	void retiredCannotBeApproved() {
		ExpertAdvisor ea = registered();
		ea.changeStatus(ExpertAdvisorStatus.RETIRED, "sunset", NOW);

		assertThatThrownBy(() -> ea.approve("reviewer", NOW)).isInstanceOf(DomainValidationException.class);
	}

	@Test
	void sameStatusIsNoOp() {
		ExpertAdvisor ea = registered();

		ea.changeStatus(ExpertAdvisorStatus.PENDING_APPROVAL, null, NOW);

		assertThat(ea.getUncommittedEvents()).hasSize(2);
	}

	@Test
	void unknownAdvisorCannotChangeStatus() {
		ExpertAdvisor ea = new ExpertAdvisor(ExpertAdvisor.idFor("t1", "ghost"));

		assertThatThrownBy(() -> ea.changeStatus(ExpertAdvisorStatus.ACTIVE, null, NOW))
				.isInstanceOf(DomainValidationException.class);
	}

	private static ExpertAdvisor registered() {
		ExpertAdvisor ea = new ExpertAdvisor(ExpertAdvisor.idFor("t1", "ea-1"));
		ea.register("t1", "ea-1", "Scalper", "EURUSD scalper", "ops", NOW);
		return ea;
	}
}
