package com.kopitra.admin.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.domain.adminuser.command.ProvisionAdminUserCommand;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserProvisioned;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.domain.shared.exception.PublishFailureException;
import com.kopitra.admin.application.service.adminuser.ProvisionAdminUserHandler;
import com.kopitra.admin.application.shared.cqrs.CommandDispatcher;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;
import com.kopitra.admin.config.config.EventCodecConfiguration;
import com.kopitra.admin.iface.handler.AdminUserProjectionHandler;
import com.kopitra.admin.iface.schedule.ProjectionRecoveryTask;
import com.kopitra.admin.infra.adapter.AdminUserReadModelAdapter;
import com.kopitra.admin.infra.adapter.InMemoryIdempotencyStoreAdapter;
import com.kopitra.admin.support.CqrsFixture;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>發布失敗後的冪等重送測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 指令的事件已寫入，但發布失敗，呼叫端以相同冪等鍵重送。
 * <b>Given</b> 排在投影之前、第一次會失敗的通知 Handler
 * <b>When</b>  首次執行失敗後重送，修復任務執行後再重送
 * <b>Then</b>  修復前重送被拒絕，修復後重送取得讀取模型的結果，指令始終只寫入一次
 * </pre>
 */
@Slf4j
class IdempotentCommandRecoveryTest {

	private final ValidatorFactory validators = Validation.buildDefaultValidatorFactory();
	private final AdminUserReadModelAdapter readModels = new AdminUserReadModelAdapter();
	private final FailOnceNotifier notifier = new FailOnceNotifier();
	private final CqrsFixture fixture = new CqrsFixture(notifier, new AdminUserProjectionHandler(readModels));
	private final CommandDispatcher commandDispatcher = new CommandDispatcher(
			List.of(new ProvisionAdminUserHandler(fixture.aggregateStore, readModels, fixture.clock)),
			validators.getValidator(), Runnable::run);
	private final IdempotentCommandService service = new IdempotentCommandService(
			new InMemoryIdempotencyStoreAdapter(fixture.clock, Duration.ofHours(24)), commandDispatcher,
			new EventCodecConfiguration().payloadHasher(), fixture.failureLog, fixture.publisher);
	private final ProjectionRecoveryTask recoveryTask = new ProjectionRecoveryTask(fixture.failureLog,
			new ReadModelRebuildService(fixture.eventStore, fixture.publisher));

	@AfterEach
	void closeValidators() {
		validators.close();
	}

	@Test
	@DisplayName("發布失敗後，修復前重送被拒絕，修復後重送回傳讀取模型結果且不重跑指令")
	void retryAfterPublishFailureReturnsRecoveredResult() {
		ProvisionAdminUserCommand command = ProvisionAdminUserCommand.builder().tenantId("t1").userId("u1")
				.email("u1@example.com").displayName("User One").role(AdminUserRole.OPERATOR).requestedBy("root")
				.build();

		assertThatThrownBy(() -> service.execute("req-1", command)).isInstanceOf(PublishFailureException.class);
		assertThat(readModels.get("t1", "u1")).isEmpty();

		assertThatThrownBy(() -> service.execute("req-1", command))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("讀取模型修復中");

		log.info(">>> [When] 執行修復任務後重送");
		recoveryTask.recover();
		AdminUserReadModel recovered = service.execute("req-1", command);

		assertThat(recovered.userId()).isEqualTo("u1");
		assertThat(recovered.roles()).containsExactly(AdminUserRole.OPERATOR);
		assertThat(service.execute("req-1", command)).isEqualTo(recovered);
		assertThat(fixture.eventStore.load("AdminUser", AdminUser.idFor("t1", "u1"))).hasSize(1);
		assertThat(notifier.handled).isEqualTo(1);
	}

	@Test
	@DisplayName("指令在寫入前失敗時釋放冪等鍵，重送會重新執行")
	void failureBeforeAppendReleasesKey() {
		ProvisionAdminUserCommand invalid = ProvisionAdminUserCommand.builder().tenantId("t1").userId("u2")
				.email("not-an-email").displayName("User Two").role(AdminUserRole.OPERATOR).requestedBy("root")
				.build();

		assertThatThrownBy(() -> service.execute("req-2", invalid)).isInstanceOf(RuntimeException.class)
				.isNotInstanceOf(PublishFailureException.class);
		assertThatThrownBy(() -> service.execute("req-2", invalid)).isNotInstanceOf(IllegalStateException.class);
		assertThat(fixture.eventStore.load("AdminUser", AdminUser.idFor("t1", "u2"))).isEmpty();
	}

	/**
	 * 第一次收到開通事件時失敗的通知 Handler，不參與重建
	 */
	private static class FailOnceNotifier implements DomainEventHandler {

		int handled;

		@Override
		public Set<Class<? extends DomainEvent>> subscribedEvents() {
			return Set.of(AdminUserProvisioned.class);
		}

		@Override
		public void handle(EventEnvelope envelope) {
			handled++;
			if (handled == 1) {
				throw new IllegalStateException("mail relay unavailable");
			}
		}
	}
}
