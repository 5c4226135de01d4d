package com.example.campuseats.domain.menu;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
	@DefaultValue("http://localhost:9000") String baseUrl,
	@DefaultValue("2s") Duration timeout
) {
}
