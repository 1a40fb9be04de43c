package com.kopitra.admin.application.domain.copytrading.aggregate.vo;

public enum CopyTradeMemberRole {

	LEADER, FOLLOWER
}
