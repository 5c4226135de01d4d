package com.example.campuseats.global.client.gemini;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "gemini.api")
public record GeminiProperties(
	String key,
	String url,
	String path,
	@DefaultValue("5s") Duration connectTimeout,
	@DefaultValue("60s") Duration readTimeout
) {
}
