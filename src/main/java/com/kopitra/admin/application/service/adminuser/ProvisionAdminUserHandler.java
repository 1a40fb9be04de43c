package com.kopitra.admin.application.service.adminuser;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.command.ProvisionAdminUserCommand;
import com.kopitra.admin.application.domain.shared.exception.ReadModelMissingException;
import com.kopitra.admin.application.port.AdminUserReadModelPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 開通管理者帳號，完成後回傳最新的讀取模型
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProvisionAdminUserHandler implements CommandHandler<ProvisionAdminUserCommand, AdminUserReadModel> {

	private final AggregateStore aggregateStore;
	private final AdminUserReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<ProvisionAdminUserCommand> commandType() {
		return ProvisionAdminUserCommand.class;
	}

	@Override
	public AdminUserReadModel handle(ProvisionAdminUserCommand command) {
		AdminUserReadModel result = aggregateStore.updateThenRead(AdminUser::new,
				AdminUser.idFor(command.getTenantId(), command.getUserId()),
				user -> user.provision(command.getTenantId(), command.getUserId(), command.getEmail(),
						command.getDisplayName(), command.getRoles(), clock.instant(), command.getRequestedBy()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("AdminUser", command.getTenantId(),
								command.getUserId())));
		log.info(">>> [AdminUser] 租戶 {} 開通管理者 {}，角色 {}", command.getTenantId(), command.getUserId(),
				command.getRoles());
		return result;
	}

	@Override
	public Optional<AdminUserReadModel> currentResult(ProvisionAdminUserCommand command) {
		return readModels.get(command.getTenantId(), command.getUserId());
	}
}
