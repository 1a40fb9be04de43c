package com.kopitra.admin.application.domain.copytrading.aggregate.vo;

/**
 * 跟單成員的風險策略
 */
public enum RiskStrategy {

	CONSERVATIVE, BALANCED, AGGRESSIVE
}
