package com.kopitra.admin.application.domain.expertadvisor.aggregate;

import java.time.Instant;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorApproved;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorEvent;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorRegistered;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorStatusChanged;
import com.kopitra.admin.application.domain.shared.AggregateRoot;
import com.kopitra.admin.application.domain.shared.DeterministicIds;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;

/**
 * <h1>Expert Advisor 聚合</h1>
 * <p>
 * 註冊後自動進入待審核狀態；已退役者不可核准，重複核准與相同狀態的變更皆不產生事件。
 * </p>
 */
public class ExpertAdvisor extends AggregateRoot<ExpertAdvisorState, ExpertAdvisorEvent> {

	public static final String ID_SCOPE = "expertadvisor";

	static final String AWAITING_APPROVAL = "Awaiting approval";

	public ExpertAdvisor(String id) {
		super(id, ExpertAdvisorState.EMPTY);
	}

	public static String idFor(String tenantId, String expertAdvisorId) {
		return DeterministicIds.derive(ID_SCOPE, tenantId, expertAdvisorId);
	}

	public void register(String tenantId, String expertAdvisorId, String displayName, String description,
			String requestedBy, Instant registeredAt) {
		if (getState().registered()) {
			throw new DomainValidationException("Expert Advisor " + expertAdvisorId + " 已註冊");
		}
		emit(new ExpertAdvisorRegistered(tenantId, expertAdvisorId, displayName, description, requestedBy,
				registeredAt));
		emit(new ExpertAdvisorStatusChanged(tenantId, expertAdvisorId, ExpertAdvisorStatus.PENDING_APPROVAL,
				AWAITING_APPROVAL, registeredAt));
	}

	public void approve(String approvedBy, Instant approvedAt) {
		requireRegistered();
		if (getState().status() == ExpertAdvisorStatus.RETIRED) {
			throw new DomainValidationException("已退役的 Expert Advisor 無法核准");
		}
		if (getState().approved()) {
			return;
		}
		emit(new ExpertAdvisorApproved(getState().tenantId(), getState().expertAdvisorId(), approvedBy, approvedAt));
		emit(new ExpertAdvisorStatusChanged(getState().tenantId(), getState().expertAdvisorId(),
				ExpertAdvisorStatus.APPROVED, null, approvedAt));
	}

	public void changeStatus(ExpertAdvisorStatus status, String reason, Instant changedAt) {
		requireRegistered();
		if (getState().status() == status) {
			return;
		}
		emit(new ExpertAdvisorStatusChanged(getState().tenantId(), getState().expertAdvisorId(), status, reason,
				changedAt));
	}

	@Override
	protected ExpertAdvisorState apply(ExpertAdvisorState state, ExpertAdvisorEvent event) {
		if (event instanceof ExpertAdvisorRegistered e) {
			return new ExpertAdvisorState(e.tenantId(), e.expertAdvisorId(), e.displayName(), e.description(),
					e.requestedBy(), false, null, ExpertAdvisorStatus.PENDING_APPROVAL);
		}
		if (event instanceof ExpertAdvisorApproved e) {
			return new ExpertAdvisorState(state.tenantId(), state.expertAdvisorId(), state.displayName(),
					state.description(), state.requestedBy(), true, e.approvedBy(), state.status());
		}
		if (event instanceof ExpertAdvisorStatusChanged e) {
			return state.withStatus(e.status());
		}
		throw new IllegalArgumentException("未知事件類型: " + event.getClass().getSimpleName());
	}

	@Override
	protected Class<ExpertAdvisorEvent> eventType() {
		return ExpertAdvisorEvent.class;
	}

	private void requireRegistered() {
		if (!getState().registered()) {
			throw new DomainValidationException("Expert Advisor " + getId() + " 尚未註冊");
		}
	}
}
