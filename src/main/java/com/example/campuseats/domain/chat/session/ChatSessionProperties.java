package com.example.campuseats.domain.chat.session;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param ttl idle time after which a session without a turn in flight is evicted
 */
@ConfigurationProperties(prefix = "chat.session")
public record ChatSessionProperties(
	@DefaultValue("2h") Duration ttl
) {
}
