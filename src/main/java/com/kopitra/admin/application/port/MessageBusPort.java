package com.kopitra.admin.application.port;

import com.kopitra.admin.application.shared.dto.BusMessage;

/**
 * 對外訊息匯流排 Port
 */
public interface MessageBusPort {

	void publish(String topic, BusMessage message);
}
