package com.kopitra.admin.application.port;

import java.util.List;

import com.kopitra.admin.application.shared.dto.PublishFailure;

/**
 * 事件發布失敗紀錄 Port，供讀取模型修復任務判斷是否需要重建
 */
public interface PublishFailureLogPort {

	void record(PublishFailure failure);

	List<PublishFailure> pending();

	/**
	 * 清除已由重建修復的紀錄
	 *
	 * @return 清除筆數
	 */
	int clear(List<PublishFailure> resolved);
}
