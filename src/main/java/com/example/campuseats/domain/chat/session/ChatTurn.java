package com.example.campuseats.domain.chat.session;

/**
 * One immutable history entry.
 */
public record ChatTurn(
	Role role,
	String text,
	Status status
) {
	public enum Role {
		USER, ASSISTANT
	}

	public enum Status {
		COMPLETED, STOPPED, FAILED
	}

	public static ChatTurn user(String text) {
		return new ChatTurn(Role.USER, text, Status.COMPLETED);
	}

	public static ChatTurn assistant(String text, Status status) {
		return new ChatTurn(Role.ASSISTANT, text, status);
	}

	public boolean fromUser() {
		return role == Role.USER;
	}
}
