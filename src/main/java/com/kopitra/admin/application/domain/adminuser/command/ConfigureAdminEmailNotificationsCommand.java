package com.kopitra.admin.application.domain.adminuser.command;

import java.util.List;

import com.kopitra.admin.application.shared.cqrs.Command;
import com.kopitra.admin.application.shared.projection.AdminUserReadModel;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 設定管理者的 Email 通知開關與訂閱主題
 */
@Value
@Builder
public class ConfigureAdminEmailNotificationsCommand implements Command<AdminUserReadModel> {

	@NotBlank
	String tenantId;
	@NotBlank
	String userId;
	boolean emailEnabled;
	@Singular
	List<String> topics;
	@NotBlank
	String requestedBy;
}
