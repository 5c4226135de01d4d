package com.example.campuseats.global.client.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiResponse(
	List<Candidate> candidates
) {
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Candidate(
		Content content,
		String finishReason
	) {
		@JsonIgnoreProperties(ignoreUnknown = true)
		public record Content(
			List<Part> parts,
			String role
		) {
			@JsonIgnoreProperties(ignoreUnknown = true)
			public record Part(
				String text
			) {
			}
		}
	}

	/**
	 * Concatenated text of every part of the first candidate; a streamed chunk may carry several parts.
	 */
	public String getFirstResponseText() {
		if (candidates != null && !candidates.isEmpty()) {
			Candidate firstCandidate = candidates.get(0);
			if (firstCandidate.content() != null &&
				firstCandidate.content().parts() != null) {
				StringBuilder text = new StringBuilder();
				for (Candidate.Content.Part part : firstCandidate.content().parts()) {
					if (part.text() != null) {
						text.append(part.text());
					}
				}
				return text.toString();
			}
		}
		return "";
	}
}
