package com.kopitra.admin.application.shared.cqrs;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;
import com.kopitra.admin.application.domain.shared.exception.HandlerNotFoundException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>指令分派器 (Command Dispatcher)</h1>
 * <p>
 * <b>職責：</b> 依指令的具體類型找到唯一的 {@link CommandHandler} 並執行。註冊表於啟動時一次建立，之後唯讀。
 * </p>
 *
 * <ul>
 * <li>同一指令類型重複註冊會在啟動時失敗。</li>
 * <li>執行前先以 Bean Validation 檢查指令內容，違規時拋出 {@link DomainValidationException}。</li>
 * <li>找不到 Handler 時拋出 {@link HandlerNotFoundException}。</li>
 * </ul>
 */
@Slf4j
public class CommandDispatcher {

	private final Map<Class<?>, CommandHandler<?, ?>> handlers;
	private final Validator validator;
	private final Executor executor;

	public CommandDispatcher(List<? extends CommandHandler<?, ?>> commandHandlers, Validator validator,
			Executor executor) {
		Map<Class<?>, CommandHandler<?, ?>> registry = new HashMap<>();
		for (CommandHandler<?, ?> handler : commandHandlers) {
			CommandHandler<?, ?> previous = registry.putIfAbsent(handler.commandType(), handler);
			if (previous != null) {
				throw new IllegalStateException("指令 " + handler.commandType().getSimpleName() + " 重複註冊: "
						+ previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
			}
		}
		this.handlers = Collections.unmodifiableMap(registry);
		this.validator = validator;
		this.executor = executor;
		log.info(">>> [CQRS] 已註冊 {} 個指令處理器", handlers.size());
	}

	/**
	 * 同步執行指令
	 *
	 * @param command 指令
	 * @return Handler 的執行結果
	 */
	@SuppressWarnings("unchecked")
	public <R> R dispatch(Command<R> command) {
		Objects.requireNonNull(command, "command 不可為空");
		CommandHandler<Command<R>, R> handler = (CommandHandler<Command<R>, R>) handlers.get(command.getClass());
		if (handler == null) {
			throw new HandlerNotFoundException(command.getClass());
		}
		validate(command);
		log.debug(">>> [CQRS] 執行指令 {} (tenant={})", command.getClass().getSimpleName(), command.getTenantId());
		return handler.handle(command);
	}

	/**
	 * 於指令執行緒池上非同步執行指令
	 */
	public <R> CompletableFuture<R> dispatchAsync(Command<R> command) {
		return CompletableFuture.supplyAsync(() -> dispatch(command), executor);
	}

	/**
	 * 由負責的 Handler 從讀取模型推得指令目前的結果，不會寫入任何事件
	 */
	@SuppressWarnings("unchecked")
	public <R> Optional<R> currentResult(Command<R> command) {
		CommandHandler<Command<R>, R> handler = (CommandHandler<Command<R>, R>) handlers.get(command.getClass());
		if (handler == null) {
			throw new HandlerNotFoundException(command.getClass());
		}
		return handler.currentResult(command);
	}

	public boolean supports(Class<?> commandType) {
		return handlers.containsKey(commandType);
	}

	private void validate(Object command) {
		Set<ConstraintViolation<Object>> violations = validator.validate(command);
		if (!violations.isEmpty()) {
			String message = violations.stream()
					.map(v -> v.getPropertyPath() + " " + v.getMessage())
					.sorted()
					.collect(Collectors.joining(", "));
			throw new DomainValidationException(command.getClass().getSimpleName() + " 驗證失敗: " + message);
		}
	}
}
