package com.kopitra.admin.application.domain.copytrading.aggregate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import com.kopitra.admin.application.domain.copytrading.aggregate.CopyTradeGroupState.Member;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupCreated;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupEvent;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberRemoved;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberUpserted;
import com.kopitra.admin.application.domain.shared.AggregateRoot;
import com.kopitra.admin.application.domain.shared.DeterministicIds;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;

/**
 * <h1>跟單群組聚合 (CopyTradeGroup)</h1>
 * <ul>
 * <li>群組建立後才能管理成員。</li>
 * <li>新增與更新成員共用同一個事件。</li>
 * <li>移除不存在的成員不產生事件。</li>
 * </ul>
 */
public class CopyTradeGroup extends AggregateRoot<CopyTradeGroupState, CopyTradeGroupEvent> {

	public static final String ID_SCOPE = "copytradegroup";

	public CopyTradeGroup(String id) {
		super(id, CopyTradeGroupState.EMPTY);
	}

	public static String idFor(String tenantId, String groupId) {
		return DeterministicIds.derive(ID_SCOPE, tenantId, groupId);
	}

	public void create(String tenantId, String groupId, String name, String description, String createdBy,
			Instant createdAt) {
		if (getState().created()) {
			throw new DomainValidationException("跟單群組 " + groupId + " 已存在");
		}
		emit(new CopyTradeGroupCreated(tenantId, groupId, name, description, createdBy, createdAt));
	}

	public void upsertMember(String memberId, CopyTradeMemberRole role, RiskStrategy riskStrategy,
			BigDecimal allocation, Instant updatedAt, String updatedBy) {
		if (!getState().created()) {
			throw new DomainValidationException("跟單群組 " + getId() + " 尚未建立，無法管理成員");
		}
		if (allocation == null || allocation.signum() <= 0) {
			throw new DomainValidationException("成員 " + memberId + " 的配置比例必須大於 0");
		}
		emit(new CopyTradeGroupMemberUpserted(getState().tenantId(), getState().groupId(), memberId, role,
				riskStrategy, allocation, updatedAt, updatedBy));
	}

	public void removeMember(String memberId, Instant removedAt, String removedBy) {
		if (!getState().members().containsKey(memberId)) {
			return;
		}
		emit(new CopyTradeGroupMemberRemoved(getState().tenantId(), getState().groupId(), memberId, removedAt,
				removedBy));
	}

	@Override
	protected CopyTradeGroupState apply(CopyTradeGroupState state, CopyTradeGroupEvent event) {
		if (event instanceof CopyTradeGroupCreated e) {
			return new CopyTradeGroupState(e.tenantId(), e.groupId(), e.name(), e.description(), e.createdBy(),
					e.createdAt(), Map.of());
		}
		if (event instanceof CopyTradeGroupMemberUpserted e) {
			Map<String, Member> members = new HashMap<>(state.members());
			members.put(e.memberId(), new Member(e.memberId(), e.role(), e.riskStrategy(), e.allocation(),
					e.updatedAt(), e.updatedBy()));
			return withMembers(state, members);
		}
		if (event instanceof CopyTradeGroupMemberRemoved e) {
			Map<String, Member> members = new HashMap<>(state.members());
			members.remove(e.memberId());
			return withMembers(state, members);
		}
		throw new IllegalArgumentException("未知事件類型: " + event.getClass().getSimpleName());
	}

	@Override
	protected Class<CopyTradeGroupEvent> eventType() {
		return CopyTradeGroupEvent.class;
	}

	private static CopyTradeGroupState withMembers(CopyTradeGroupState state, Map<String, Member> members) {
		return new CopyTradeGroupState(state.tenantId(), state.groupId(), state.name(), state.description(),
				state.createdBy(), state.createdAt(), members);
	}
}
