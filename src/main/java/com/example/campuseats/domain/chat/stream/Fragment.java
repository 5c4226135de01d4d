package com.example.campuseats.domain.chat.stream;

/**
 * One unit of a streamed reply. Status fragments announce a tool call and are replaced by the
 * next fragment on the client; content fragments are the answer itself.
 */
public record Fragment(
	FragmentKind kind,
	String payload
) {
	public static Fragment status(String payload) {
		return new Fragment(FragmentKind.STATUS, payload);
	}

	public static Fragment content(String payload) {
		return new Fragment(FragmentKind.CONTENT, payload);
	}

	public boolean isStatus() {
		return kind == FragmentKind.STATUS;
	}

	/**
	 * Text written to the response body: status as a bracketed line, content verbatim.
	 */
	public String encode() {
		return isStatus() ? "[" + payload + "]\n" : payload;
	}
}
