package com.kopitra.admin.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.kopitra.admin.infra.event.codec.EventEnvelopeCodec;
import com.kopitra.admin.infra.event.codec.ManagementEventTypes;
import com.kopitra.admin.infra.event.codec.PayloadHasher;

import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 事件日誌與請求雜湊各自使用獨立的 JsonMapper，不受應用層 ObjectMapper 設定影響。
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	/**
	 * 事件信封的 Codec，註冊所有事件的類型標籤
	 */
	@Bean
	public EventEnvelopeCodec eventEnvelopeCodec() {
		JsonMapper mapper = JsonMapper.builder()
				.registerSubtypes(ManagementEventTypes.all().toArray(new Class<?>[0]))
				.build();
		return new EventEnvelopeCodec(mapper);
	}

	/**
	 * 指令內容雜湊，欄位依字母排序以確保相同內容得到相同雜湊
	 */
	@Bean
	public PayloadHasher payloadHasher() {
		JsonMapper mapper = JsonMapper.builder()
				.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
				.build();
		return new PayloadHasher(mapper);
	}
}
