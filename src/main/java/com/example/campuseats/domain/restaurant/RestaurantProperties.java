package com.example.campuseats.domain.restaurant;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.core.io.Resource;

/**
 * @param schedule JSON array of {@code {name, open, close}} entries, times as {@code HH:mm}
 * @param zone     time zone the opening hours are written in
 */
@ConfigurationProperties(prefix = "restaurant")
public record RestaurantProperties(
	@DefaultValue("classpath:restaurants.json") Resource schedule,
	@DefaultValue("Asia/Dubai") String zone
) {
}
