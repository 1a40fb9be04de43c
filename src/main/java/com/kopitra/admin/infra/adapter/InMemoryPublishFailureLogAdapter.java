package com.kopitra.admin.infra.adapter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Component;

import com.kopitra.admin.application.port.PublishFailureLogPort;
import com.kopitra.admin.application.shared.dto.PublishFailure;

@Component
public class InMemoryPublishFailureLogAdapter implements PublishFailureLogPort {

	private final List<PublishFailure> failures = new CopyOnWriteArrayList<>();

	@Override
	public void record(PublishFailure failure) {
		failures.add(failure);
	}

	@Override
	public List<PublishFailure> pending() {
		return List.copyOf(failures);
	}

	@Override
	public int clear(List<PublishFailure> resolved) {
		int count = 0;
		for (PublishFailure failure : resolved) {
			if (failures.remove(failure)) {
				count++;
			}
		}
		return count;
	}
}
