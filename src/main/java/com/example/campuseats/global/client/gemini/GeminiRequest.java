package com.example.campuseats.global.client.gemini;

import java.util.ArrayList;
import java.util.List;

import com.example.campuseats.global.client.GenerationPrompt;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeminiRequest(
	Content systemInstruction,
	List<Content> contents
) {
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Content(
		String role,
		List<Part> parts
	) {
		public record Part(
			String text
		) {
		}

		static Content of(String role, String text) {
			return new Content(role, List.of(new Part(text)));
		}
	}

	public static GeminiRequest of(String prompt) {
		return new GeminiRequest(null, List.of(Content.of("user", prompt)));
	}

	public static GeminiRequest from(GenerationPrompt prompt) {
		StringBuilder instruction = new StringBuilder(prompt.systemInstruction() == null ? "" : prompt.systemInstruction());
		if (prompt.toolContext() != null && !prompt.toolContext().isBlank()) {
			instruction.append("\n\n").append(prompt.toolContext());
		}

		List<Content> contents = new ArrayList<>();
		for (GenerationPrompt.Turn turn : prompt.history()) {
			if (turn.text() == null || turn.text().isBlank()) {
				continue;
			}
			contents.add(Content.of(turn.fromUser() ? "user" : "model", turn.text()));
		}
		contents.add(Content.of("user", prompt.userMessage()));

		Content system = instruction.isEmpty() ? null : new Content(null, List.of(new Content.Part(instruction.toString())));
		return new GeminiRequest(system, contents);
	}
}
