package com.kopitra.admin.application.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.domain.adminuser.command.UpdateAdminUserRolesCommand;
import com.kopitra.admin.application.domain.shared.DomainEvent;
import com.kopitra.admin.application.domain.shared.EventEnvelope;
import com.kopitra.admin.application.service.adminuser.UpdateAdminUserRolesHandler;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;
import com.kopitra.admin.iface.handler.AdminUserProjectionHandler;
import com.kopitra.admin.infra.adapter.AdminUserReadModelAdapter;
import com.kopitra.admin.support.CqrsFixture;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>重建期間的即時寫入測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 讀取模型重建已清空投影，尚未重播事件時，另一個執行緒送出角色變更。
 * <b>Given</b> 已開通的管理者 (版本 0)
 * <b>When</b>  重建清空投影的同時，即時寫入版本 1
 * <b>Then</b>  即時寫入等到重播結束後才寫入與發布，讀取模型不會遺失這次變更，寫入端也不會讀不到讀取模型
 * </pre>
 */
@Slf4j
class ReadModelRebuildConcurrencyTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private final AdminUserReadModelAdapter readModels = new AdminUserReadModelAdapter();
	private final LiveWriteOnReset liveWrite = new LiveWriteOnReset();
	private final CqrsFixture fixture = new CqrsFixture(new AdminUserProjectionHandler(readModels), liveWrite);
	private final ReadModelRebuildService rebuildService = new ReadModelRebuildService(fixture.eventStore,
			fixture.publisher);
	private final UpdateAdminUserRolesHandler updateRoles = new UpdateAdminUserRolesHandler(fixture.aggregateStore,
			readModels, fixture.clock);

	@Test
	@DisplayName("重建期間送出的變更在重播後套用，不會被重建覆蓋")
	void liveWriteDuringRebuildIsKept() throws Exception {
		fixture.aggregateStore.update(AdminUser::new, AdminUser.idFor("t1", "u1"), u -> u.provision("t1", "u1",
				"u1@example.com", "User One", List.of(AdminUserRole.OPERATOR), NOW, "root"));

		log.info(">>> [When] 開始重建，清空投影時送出即時寫入");
		int replayed = rebuildService.rebuild();

		AdminUserReadModel written = liveWrite.task.get(5, TimeUnit.SECONDS);
		assertThat(replayed).isEqualTo(1);
		assertThat(written.roles()).containsExactly(AdminUserRole.AUDITOR);
		assertThat(fixture.eventStore.load("AdminUser", AdminUser.idFor("t1", "u1")))
				.extracting(EventEnvelope::version).containsExactly(0L, 1L);
		assertThat(readModels.get("t1", "u1").orElseThrow().roles()).containsExactly(AdminUserRole.AUDITOR);
	}

	/**
	 * 被重建清空時啟動一次即時寫入，並等到該寫入被擋住才讓重建繼續
	 */
	private class LiveWriteOnReset implements DomainEventHandler {

		private FutureTask<AdminUserReadModel> task;

		@Override
		public Set<Class<? extends DomainEvent>> subscribedEvents() {
			return Set.of();
		}

		@Override
		public void handle(EventEnvelope envelope) {
		}

		@Override
		public boolean replayable() {
			return true;
		}

		@Override
		public void reset() {
			task = new FutureTask<>(() -> updateRoles.handle(UpdateAdminUserRolesCommand.builder().tenantId("t1")
					.userId("u1").role(AdminUserRole.AUDITOR).requestedBy("root").build()));
			Thread writer = new Thread(task, "live-writer");
			writer.start();
			Awaitility.await().atMost(Duration.ofSeconds(5))
					.until(() -> writer.getState() == Thread.State.WAITING || task.isDone());
		}
	}
}
