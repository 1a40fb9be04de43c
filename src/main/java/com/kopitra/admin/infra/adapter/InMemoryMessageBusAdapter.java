package com.kopitra.admin.infra.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.MessageBusPort;
import com.kopitra.admin.application.shared.dto.BusMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * 記憶體訊息匯流排，訊息暫存於佇列中直到被取出
 */
@Slf4j
@Component
public class InMemoryMessageBusAdapter implements MessageBusPort {

	private final ConcurrentLinkedQueue<TopicMessage> messages = new ConcurrentLinkedQueue<>();

	@Override
	public void publish(String topic, BusMessage message) {
		messages.add(new TopicMessage(topic, message));
		log.debug(">>> [MessageBus] {} <- {} ({})", topic, message.type(), message.businessId());
	}

	/**
	 * 取出目前累積的所有訊息
	 */
	public List<TopicMessage> drain() {
		List<TopicMessage> drained = new ArrayList<>();
		TopicMessage next;
		while ((next = messages.poll()) != null) {
			drained.add(next);
		}
		return drained;
	}

	public record TopicMessage(String topic, BusMessage message) {
	}
}
