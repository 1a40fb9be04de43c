package com.kopitra.admin.config.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 系統時鐘配置，事件時間與冪等鍵到期皆由此取得，測試時可替換為固定時鐘
 */
@Configuration
public class TimeConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
