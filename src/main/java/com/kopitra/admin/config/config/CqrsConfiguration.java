package com.kopitra.admin.config.config;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.kopitra.admin.application.port.EventStorePort;
import com.kopitra.admin.application.port.PublishFailureLogPort;
import com.kopitra.admin.application.shared.cqrs.AggregateStore;
import com.kopitra.admin.application.shared.cqrs.CommandDispatcher;
import com.kopitra.admin.application.shared.cqrs.CommandHandler;
import com.kopitra.admin.application.shared.cqrs.DomainEventHandler;
import com.kopitra.admin.application.shared.cqrs.DomainEventPublisher;
import com.kopitra.admin.application.shared.cqrs.QueryDispatcher;
import com.kopitra.admin.application.shared.cqrs.QueryHandler;

import jakarta.validation.Validator;

/**
 * <h1>CQRS 核心組裝</h1>
 * <p>
 * 所有 Handler 由 Spring 掃描後於此一次註冊進分派器與發布器，註冊表之後不再變動。
 * </p>
 */
@Configuration
public class CqrsConfiguration {

	/**
	 * 非同步指令使用的執行緒池
	 */
	@Bean
	public ThreadPoolTaskExecutor commandExecutor(@Value("${kopitra.cqrs.executor.core-size:4}") int coreSize,
			@Value("${kopitra.cqrs.executor.max-size:8}") int maxSize,
			@Value("${kopitra.cqrs.executor.queue-capacity:1000}") int queueCapacity) {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(coreSize);
		executor.setMaxPoolSize(maxSize);
		executor.setQueueCapacity(queueCapacity);
		executor.setThreadNamePrefix("command-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		return executor;
	}

	@Bean
	public DomainEventPublisher domainEventPublisher(List<DomainEventHandler> eventHandlers) {
		return new DomainEventPublisher(eventHandlers);
	}

	@Bean
	public AggregateStore aggregateStore(EventStorePort eventStore, DomainEventPublisher publisher,
			PublishFailureLogPort publishFailureLog, Clock clock) {
		return new AggregateStore(eventStore, publisher, publishFailureLog, clock);
	}

	@Bean
	public CommandDispatcher commandDispatcher(List<CommandHandler<?, ?>> commandHandlers, Validator validator,
			@Qualifier("commandExecutor") Executor commandExecutor) {
		return new CommandDispatcher(commandHandlers, validator, commandExecutor);
	}

	@Bean
	public QueryDispatcher queryDispatcher(List<QueryHandler<?, ?>> queryHandlers, DomainEventPublisher publisher) {
		return new QueryDispatcher(queryHandlers, publisher);
	}
}
