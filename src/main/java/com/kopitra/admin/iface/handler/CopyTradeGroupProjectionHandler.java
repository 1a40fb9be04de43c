package com.kopitra.admin.iface.handler;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupCreated;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberRemoved;
import com.kopitra.admin.application.domain.copytrading.event.CopyTradeGroupMemberUpserted;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.CopyTradeGroupReadModelPort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel.Member;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>跟單群組讀取模型投影</h1>
 * <p>
 * 成員清單一律依 memberId 排序後寫入。成員事件早於群組建立事件抵達時，以事件時間作為暫定建立時間。
 * </p>
 */
@Slf4j
@Order(0)
@Component
@RequiredArgsConstructor
public class CopyTradeGroupProjectionHandler implements DomainEventHandler {

	private static final Comparator<Member> BY_MEMBER_ID = Comparator.comparing(Member::memberId);

	private final CopyTradeGroupReadModelPort readModels;

	@Override
	public Set<Class<? extends DomainEvent>> subscribedEvents() {
		return Set.of(CopyTradeGroupCreated.class, CopyTradeGroupMemberUpserted.class,
				CopyTradeGroupMemberRemoved.class);
	}

	@Override
	public void handle(EventEnvelope envelope) {
		DomainEvent event = envelope.payload();
		if (event instanceof CopyTradeGroupCreated e) {
			readModels.upsert(new CopyTradeGroupReadModel(e.tenantId(), e.groupId(), e.name(), e.description(),
					e.createdBy(), e.createdAt(), List.of()));
		} else if (event instanceof CopyTradeGroupMemberUpserted e) {
			Optional<CopyTradeGroupReadModel> existing = readModels.get(e.tenantId(), e.groupId());
			Map<String, Member> members = membersOf(existing);
			members.put(e.memberId(), new Member(e.memberId(), e.role(), e.riskStrategy(), e.allocation(),
					envelope.timestamp(), e.updatedBy()));
			readModels.upsert(new CopyTradeGroupReadModel(e.tenantId(), e.groupId(),
					existing.map(CopyTradeGroupReadModel::name).orElse(""),
					existing.map(CopyTradeGroupReadModel::description).orElse(null),
					existing.map(CopyTradeGroupReadModel::createdBy).orElse(""),
					existing.map(CopyTradeGroupReadModel::createdAt).orElse(envelope.timestamp()), sorted(members)));
		} else if (event instanceof CopyTradeGroupMemberRemoved e) {
			Optional<CopyTradeGroupReadModel> existing = readModels.get(e.tenantId(), e.groupId());
			if (existing.isEmpty()) {
				log.warn(">>> [Projection] {}@{} 找不到跟單群組讀取模型，略過", envelope.streamId(), envelope.version());
				return;
			}
			Map<String, Member> members = membersOf(existing);
			members.remove(e.memberId());
			CopyTradeGroupReadModel group = existing.get();
			readModels.upsert(new CopyTradeGroupReadModel(group.tenantId(), group.groupId(), group.name(),
					group.description(), group.createdBy(), group.createdAt(), sorted(members)));
		}
	}

	@Override
	public boolean replayable() {
		return true;
	}

	@Override
	public void reset() {
		readModels.clear();
	}

	private static Map<String, Member> membersOf(Optional<CopyTradeGroupReadModel> group) {
		Map<String, Member> members = new LinkedHashMap<>();
		group.ifPresent(g -> g.members().forEach(m -> members.put(m.memberId(), m)));
		return members;
	}

	private static List<Member> sorted(Map<String, Member> members) {
		return members.values().stream().sorted(BY_MEMBER_ID).toList();
	}
}
