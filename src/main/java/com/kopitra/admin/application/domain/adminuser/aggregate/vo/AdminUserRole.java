package com.kopitra.admin.application.domain.adminuser.aggregate.vo;

/**
 * 管理者角色
 */
public enum AdminUserRole {

	OPERATOR, SUPERVISOR, AUDITOR, ADMIN
}
