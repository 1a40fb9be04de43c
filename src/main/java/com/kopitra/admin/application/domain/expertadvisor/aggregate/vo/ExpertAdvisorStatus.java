package com.kopitra.admin.application.domain.expertadvisor.aggregate.vo;

/**
 * Expert Advisor 生命週期狀態
 */
public enum ExpertAdvisorStatus {

	DRAFT, PENDING_APPROVAL, APPROVED, ACTIVE, SUSPENDED, RETIRED
}
