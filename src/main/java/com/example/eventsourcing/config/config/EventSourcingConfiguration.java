package com.example.eventsourcing.config.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.eventsourcing.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Event Sourcing 基礎元件配置
 * <p>
 * 提供事件 JSON 編解碼器，以及 Event Store 寫入時使用的交易模板。
 * </p>
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventSourcingConfiguration {

	/**
	 * 事件專用的 ObjectMapper，舊事件多出的欄位不應導致重播失敗
	 */
	@Bean
	public JsonMapper eventObjectMapper() {
		return JsonMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();
	}

	@Bean
	public EventJsonCodec eventJsonCodec(ObjectMapper eventObjectMapper) {
		return new EventJsonCodec(eventObjectMapper);
	}

	@Bean
	public TransactionTemplate eventStoreTransactionTemplate(PlatformTransactionManager transactionManager) {
		return new TransactionTemplate(transactionManager);
	}
}
