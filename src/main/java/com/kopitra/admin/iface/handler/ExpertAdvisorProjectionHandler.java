package com.kopitra.admin.iface.handler;

import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorApproved;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorRegistered;
import com.kopitra.admin.application.domain.expertadvisor.event.ExpertAdvisorStatusChanged;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.port.ExpertAdvisorReadModelPort;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.ExpertAdvisorReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expert Advisor 讀取模型投影
 */
@Slf4j
@Order(0)
@Component
@RequiredArgsConstructor
public class ExpertAdvisorProjectionHandler implements DomainEventHandler {

	private final ExpertAdvisorReadModelPort readModels;

	@Override
	public Set<Class<? extends DomainEvent>> subscribedEvents() {
		return Set.of(ExpertAdvisorRegistered.class, ExpertAdvisorApproved.class, ExpertAdvisorStatusChanged.class);
	}

	@Override
	public void handle(EventEnvelope envelope) {
		DomainEvent event = envelope.payload();
		if (event instanceof ExpertAdvisorRegistered e) {
			readModels.upsert(new ExpertAdvisorReadModel(e.tenantId(), e.expertAdvisorId(), e.displayName(),
					e.description(), ExpertAdvisorStatus.PENDING_APPROVAL, null, envelope.timestamp()));
		} else if (event instanceof ExpertAdvisorApproved e) {
			readModels.get(e.tenantId(), e.expertAdvisorId()).ifPresentOrElse(
					existing -> readModels.upsert(new ExpertAdvisorReadModel(existing.tenantId(),
							existing.expertAdvisorId(), existing.displayName(), existing.description(),
							existing.status(), e.approvedBy(), envelope.timestamp())),
					() -> skip(envelope));
		} else if (event instanceof ExpertAdvisorStatusChanged e) {
			readModels.get(e.tenantId(), e.expertAdvisorId()).ifPresentOrElse(
					existing -> readModels.upsert(new ExpertAdvisorReadModel(existing.tenantId(),
							existing.expertAdvisorId(), existing.displayName(), existing.description(), e.status(),
							existing.approvedBy(), envelope.timestamp())),
					() -> skip(envelope));
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

	private void skip(EventEnvelope envelope) {
		log.warn(">>> [Projection] {}@{} 找不到 Expert Advisor 讀取模型，略過", envelope.streamId(), envelope.version());
	}
}
