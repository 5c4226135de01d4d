package com.example.campuseats.global.client;

import java.util.List;

/**
 * Everything the generation engine sees for one turn: the system instruction, verified tool
 * context, prior conversation and the new user message.
 */
public record GenerationPrompt(
	String systemInstruction,
	String toolContext,
	List<Turn> history,
	String userMessage
) {
	public GenerationPrompt {
		history = history == null ? List.of() : List.copyOf(history);
	}

	public record Turn(
		boolean fromUser,
		String text
	) {
	}
}
