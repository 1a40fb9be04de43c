package com.kopitra.admin.application.service.adminuser;

import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.kopitra.admin.application.domain.adminuser.aggregate.AdminUser;
import com.kopitra.admin.application.domain.adminuser.command.UpdateAdminUserRolesCommand;
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
public class UpdateAdminUserRolesHandler implements CommandHandler<UpdateAdminUserRolesCommand, AdminUserReadModel> {

	private final AggregateStore aggregateStore;
	private final AdminUserReadModelPort readModels;
	private final Clock clock;

	@Override
	public Class<UpdateAdminUserRolesCommand> commandType() {
		return UpdateAdminUserRolesCommand.class;
	}

	@Override
	public AdminUserReadModel handle(UpdateAdminUserRolesCommand command) {
		AdminUserReadModel result = aggregateStore.updateThenRead(AdminUser::new,
				AdminUser.idFor(command.getTenantId(), command.getUserId()),
				user -> user.updateRoles(command.getRoles(), clock.instant(), command.getRequestedBy()),
				() -> currentResult(command).orElseThrow(
						() -> new ReadModelMissingException("AdminUser", command.getTenantId(), command.getUserId())));
		log.info(">>> [AdminUser] 租戶 {} 更新管理者 {} 角色為 {}", command.getTenantId(), command.getUserId(),
				command.getRoles());
		return result;
	}

	@Override
	public Optional<AdminUserReadModel> currentResult(UpdateAdminUserRolesCommand command) {
		return readModels.get(command.getTenantId(), command.getUserId());
	}
}
