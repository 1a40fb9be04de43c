package com.kopitra.admin.application.service.adminuser;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.command.ConfigureAdminEmailNotificationsCommand;
import com.kopitra.admin.application.domain.shared.exception.ReadModelMissingException;
import com.kopitra.admin.application.port.AdminUserReadModelPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigureAdminEmailNotificationsHandler
		implements CommandHandler<ConfigureAdminEmailNotificationsCommand, AdminUserReadModel> {

	private final AggregateStore aggregateStore;
	private final AdminUserReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<ConfigureAdminEmailNotificationsCommand> commandType() {
		return ConfigureAdminEmailNotificationsCommand.class;
	}

	@Override
	public AdminUserReadModel handle(ConfigureAdminEmailNotificationsCommand command) {
		AdminUserReadModel result = aggregateStore.updateThenRead(AdminUser::new,
				AdminUser.idFor(command.getTenantId(), command.getUserId()),
				user -> user.updateNotificationSettings(command.isEmailEnabled(), command.getTopics(),
						clock.instant(), command.getRequestedBy()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("AdminUser", command.getTenantId(),
								command.getUserId())));
		log.info(">>> [AdminUser] 租戶 {} 管理者 {} 通知設定: email={}, topics={}", command.getTenantId(),
				command.getUserId(), command.isEmailEnabled(), command.getTopics());
		return result;
	}

	@Override
	public Optional<AdminUserReadModel> currentResult(ConfigureAdminEmailNotificationsCommand command) {
		return readModels.get(command.getTenantId(), command.getUserId());
	}
}
