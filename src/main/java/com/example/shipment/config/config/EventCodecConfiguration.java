package com.example.shipment.config.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.shipment.infra.event.codec.JsonPayloadCodec;

import tools.jackson.databind.ObjectMapper;

/**
 * 編解碼與時間來源的配置類
 */
@Configuration
public class EventCodecConfiguration {

	/**
	 * 事件與快照共用的 JSON 編解碼器
	 */
	@Bean
	public JsonPayloadCodec jsonPayloadCodec(ObjectMapper objectMapper) {
		return new JsonPayloadCodec(objectMapper);
	}

	/**
	 * 事件發生時間的時間來源
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
