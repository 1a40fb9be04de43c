package com.kopitra.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.domain.adminuser.command.ConfigureAdminEmailNotificationsCommand;
import com.kopitra.admin.application.domain.adminuser.command.ProvisionAdminUserCommand;
import com.kopitra.admin.application.domain.adminuser.command.UpdateAdminUserRolesCommand;
import com.kopitra.admin.application.domain.adminuser.query.ListAdminUsersQuery;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.CopyTradeMemberRole;
import com.kopitra.admin.application.domain.copytrading.aggregate.vo.RiskStrategy;
import com.kopitra.admin.application.domain.copytrading.command.CreateCopyTradeGroupCommand;
import com.kopitra.admin.application.domain.copytrading.command.UpsertCopyTradeGroupMemberCommand;
import com.kopitra.admin.application.domain.copytrading.query.GetCopyTradeGroupQuery;
import com.kopitra.admin.application.domain.expertadvisor.aggregate.vo.ExpertAdvisorStatus;
import com.kopitra.admin.application.domain.expertadvisor.command.RegisterExpertAdvisorCommand;
import com.kopitra.admin.application.domain.expertadvisor.command.UpdateExpertAdvisorStatusCommand;
import com.kopitra.admin.application.domain.expertadvisor.query.GetExpertAdvisorQuery;
import com.kopitra.admin.application.domain.integration.command.RecordEaIntegrationEventCommand;
import com.kopitra.admin.application.domain.integration.model.EaIntegrationEvent;
import com.kopitra.admin.application.domain.integration.query.ListEaIntegrationEventsQuery;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;
import com.kopitra.admin.application.port.EventStorePort;
import com.kopitra.admin.application.shared.cqrs.CommandDispatcher;
import com.kopitra.admin.application.shared.cqrs.QueryDispatcher;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;
import com.kopitra.admin.application.shared.projection.CopyTradeGroupReadModel;
import com.kopitra.admin.iface.handler.CopyTradeMemberMessagingHandler;
import com.kopitra.admin.iface.handler.ExpertAdvisorMessagingHandler;
import com.kopitra.admin.infra.adapter.InMemoryMessageBusAdapter;
import com.kopitra.admin.infra.adapter.InMemoryMessageBusAdapter.TopicMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>管理後台端到端測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 透過指令與查詢分派器操作完整的 Spring Context。
 * <b>Given</b> 記憶體版的事件儲存、讀取模型與訊息匯流排
 * <b>When</b>  依序送出管理者、Expert Advisor、跟單群組與整合事件的指令
 * <b>Then</b>  事件流版本連續、讀取模型同步更新、對外訊息依主題送出
 * </pre>
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class KopitraAdminApplicationTest {

	@Autowired
	private CommandDispatcher commandDispatcher;

	@Autowired
	private QueryDispatcher queryDispatcher;

	@Autowired
	private EventStorePort eventStore;

	@Autowired
	private InMemoryMessageBusAdapter messageBus;

	@BeforeEach
	void setUp() {
		messageBus.drain();
	}

	@Test
	@DisplayName("開通管理者後更新角色，讀取模型與事件流一致")
	void adminUserLifecycle() {
		log.info(">>> [Given] 開通管理者 u1，角色 OPERATOR");
		AdminUserReadModel provisioned = commandDispatcher.dispatch(ProvisionAdminUserCommand.builder()
				.tenantId("e2e-admin").userId("u1").email("u1@example.com").displayName("User One")
				.role(AdminUserRole.OPERATOR).requestedBy("root").build());
		assertThat(provisioned.roles()).containsExactly(AdminUserRole.OPERATOR);
		assertThat(queryDispatcher.dispatch(new ListAdminUsersQuery("e2e-admin"))).singleElement()
				.satisfies(u -> assertThat(u.roles()).containsExactly(AdminUserRole.OPERATOR));

		log.info(">>> [When] 更新角色為 OPERATOR + ADMIN");
		commandDispatcher.dispatch(UpdateAdminUserRolesCommand.builder().tenantId("e2e-admin").userId("u1")
				.role(AdminUserRole.ADMIN).role(AdminUserRole.OPERATOR).requestedBy("root").build());

		List<AdminUserReadModel> users = queryDispatcher.dispatch(new ListAdminUsersQuery("e2e-admin"));
		assertThat(users).singleElement()
				.satisfies(u -> assertThat(u.roles()).containsExactly(AdminUserRole.OPERATOR, AdminUserRole.ADMIN));

		List<EventEnvelope> stream = eventStore.load("AdminUser", AdminUser.idFor("e2e-admin", "u1"));
		assertThat(stream).extracting(EventEnvelope::version).containsExactly(0L, 1L);
		assertThat(stream).extracting(e -> e.metadata().get("eventType"))
				.containsExactly("admin-user-provisioned", "admin-user-roles-updated");
		log.info(">>> [Then] 事件流: {}", stream.stream().map(EventEnvelope::streamId).distinct().toList());
	}

	@Test
	void notificationSettingsAreNormalized() {
		commandDispatcher.dispatch(ProvisionAdminUserCommand.builder().tenantId("e2e-notify").userId("u1")
				.email("u1@example.com").displayName("User One").role(AdminUserRole.AUDITOR).requestedBy("root")
				.build());

		AdminUserReadModel updated = commandDispatcher.dispatch(ConfigureAdminEmailNotificationsCommand.builder()
				.tenantId("e2e-notify").userId("u1").emailEnabled(true).topic(" risk ").topic("").topic("RISK")
				.topic("deploy").requestedBy("root").build());

		assertThat(updated.emailEnabled()).isTrue();
		assertThat(updated.topics()).containsExactly("risk", "deploy");
	}

	@Test
	@DisplayName("註冊 Expert Advisor 時更新讀取模型並送出訊息")
	void expertAdvisorPublishesMessages() {
		commandDispatcher.dispatch(RegisterExpertAdvisorCommand.builder().tenantId("e2e-ea").expertAdvisorId("ea-1")
				.displayName("Trend Rider").description("H4 trend follower").requestedBy("ops").build());
		commandDispatcher.dispatch(UpdateExpertAdvisorStatusCommand.builder().tenantId("e2e-ea")
				.expertAdvisorId("ea-1").status(ExpertAdvisorStatus.SUSPENDED).reason("drawdown limit")
				.requestedBy("ops").build());

		assertThat(queryDispatcher.dispatch(new GetExpertAdvisorQuery("e2e-ea", "ea-1"))).get()
				.satisfies(ea -> assertThat(ea.status()).isEqualTo(ExpertAdvisorStatus.SUSPENDED));

		List<TopicMessage> messages = messageBus.drain();
		assertThat(messages).extracting(TopicMessage::topic).containsOnly(ExpertAdvisorMessagingHandler.TOPIC);
		assertThat(messages).extracting(m -> m.message().type()).containsExactly("expert-advisor-registered",
				"expert-advisor-status-changed", "expert-advisor-status-changed");
		assertThat(messages.get(2).message().attributes()).containsEntry("status", "SUSPENDED")
				.containsEntry("reason", "drawdown limit");
	}

	@Test
	@DisplayName("非同步建立跟單群組並加入成員")
	void copyTradeGroupAsync() {
		CompletableFuture<CopyTradeGroupReadModel> created = commandDispatcher
				.dispatchAsync(CreateCopyTradeGroupCommand.builder().tenantId("e2e-copy").groupId("g1").name("Alpha")
						.requestedBy("ops").build());
		await().atMost(Duration.ofSeconds(5)).until(created::isDone);
		assertThat(created).isCompleted();

		commandDispatcher.dispatch(UpsertCopyTradeGroupMemberCommand.builder().tenantId("e2e-copy").groupId("g1")
				.memberId("leader-1").role(CopyTradeMemberRole.LEADER).riskStrategy(RiskStrategy.AGGRESSIVE)
				.allocation(new BigDecimal("1.0")).requestedBy("ops").build());

		assertThat(queryDispatcher.dispatch(new GetCopyTradeGroupQuery("e2e-copy", "g1"))).get()
				.satisfies(g -> assertThat(g.members()).singleElement()
						.satisfies(m -> assertThat(m.role()).isEqualTo(CopyTradeMemberRole.LEADER)));
		assertThat(messageBus.drain()).extracting(TopicMessage::topic)
				.containsExactly(CopyTradeMemberMessagingHandler.TOPIC);
	}

	@Test
	void invalidAllocationIsRejected() {
		commandDispatcher.dispatch(CreateCopyTradeGroupCommand.builder().tenantId("e2e-copy-invalid").groupId("g1")
				.name("Alpha").requestedBy("ops").build());

		assertThatThrownBy(() -> commandDispatcher.dispatch(UpsertCopyTradeGroupMemberCommand.builder()
				.tenantId("e2e-copy-invalid").groupId("g1").memberId("m1").role(CopyTradeMemberRole.FOLLOWER)
				.riskStrategy(RiskStrategy.CONSERVATIVE).allocation(BigDecimal.ZERO).requestedBy("ops").build()))
				.isInstanceOf(DomainValidationException.class);
	}

	@Test
	@DisplayName("EA 整合事件依發生時間新到舊列出")
	void integrationEventsAreListedNewestFirst() {
		Instant base = Instant.parse("2024-05-01T08:00:00Z");
		commandDispatcher.dispatch(RecordEaIntegrationEventCommand.builder().tenantId("e2e-int").source("mt5-gw")
				.eventType("order-filled").payload("{\"ticket\":1}").occurredAt(base).build());
		commandDispatcher.dispatch(RecordEaIntegrationEventCommand.builder().tenantId("e2e-int").source("mt5-gw")
				.eventType("order-closed").payload("{\"ticket\":1}").occurredAt(base.plusSeconds(30)).build());

		List<EaIntegrationEvent> events = queryDispatcher.dispatch(new ListEaIntegrationEventsQuery("e2e-int"));
		assertThat(events).extracting(EaIntegrationEvent::eventType).containsExactly("order-closed", "order-filled");
		assertThat(events).allSatisfy(e -> assertThat(e.receivedAt()).isNotNull());
	}
}
