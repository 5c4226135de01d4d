package com.example.campuseats.domain.chat.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.swagger.v3.oas.annotations.media.Schema;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryMessage(
	@Schema(description = "Who wrote the message", example = "user", allowableValues = {"user", "bot"})
	String sender,
	@Schema(description = "Message text", example = "Is Margherita available?")
	String text
) {
}
