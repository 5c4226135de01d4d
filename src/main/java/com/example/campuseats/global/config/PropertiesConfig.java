package com.example.campuseats.global.config;

import com.example.campuseats.domain.chat.session.ChatSessionProperties;
import com.example.campuseats.domain.menu.CatalogProperties;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.restaurant.RestaurantProperties;
import com.example.campuseats.global.client.gemini.GeminiProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(value = {
	GeminiProperties.class,
	CatalogProperties.class,
	OrderProperties.class,
	ChatSessionProperties.class,
	RestaurantProperties.class
})
public class PropertiesConfig {
}
