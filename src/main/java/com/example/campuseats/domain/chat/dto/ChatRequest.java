package com.example.campuseats.domain.chat.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
	@Schema(description = "The new user message", example = "Can I order a pepperoni and margherita pizza")
	@NotBlank
	@Size(max = 2000)
	String message,

	@Schema(description = "Earlier messages, only used to seed a new session")
	List<HistoryMessage> history,

	@Schema(description = "Opaque conversation key", example = "3f2a9c")
	@JsonProperty("session_id")
	@Size(max = 128)
	String sessionId
) {
	public static final String DEFAULT_SESSION_ID = "default";

	public ChatRequest {
		history = history == null ? List.of() : List.copyOf(history);
		if (sessionId == null || sessionId.isBlank()) {
			sessionId = DEFAULT_SESSION_ID;
		}
	}
}
