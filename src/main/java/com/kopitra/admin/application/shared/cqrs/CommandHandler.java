package com.kopitra.admin.application.shared.cqrs;

import java.util.Optional;

/**
 * 指令處理器，每種指令類型只能有一個
 *
 * @param <C> 指令類型
 * @param <R> 回傳類型
 */
public interface CommandHandler<C extends Command<R>, R> {

	/**
	 * 負責處理的指令類型，作為 {@link CommandDispatcher} 的註冊鍵
	 */
	Class<C> commandType();

	R handle(C command);

	/**
	 * 不重新執行指令，直接從讀取模型取得該指令目前的結果
	 * <p>
	 * 供冪等重試在「已寫入但發布失敗」後回應使用；無法由讀取模型推得結果的 Handler 維持空值。
	 * </p>
	 */
	default Optional<R> currentResult(C command) {
		return Optional.empty();
	}
}
