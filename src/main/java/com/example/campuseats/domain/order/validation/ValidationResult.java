package com.example.campuseats.domain.order.validation;

/**
 * Outcome of checking one field value. {@code value} is the normalized value when valid and
 * {@code reason} explains the rejection otherwise.
 */
public record ValidationResult(
	boolean valid,
	String value,
	String reason
) {
	public static ValidationResult valid(String value) {
		return new ValidationResult(true, value, null);
	}

	public static ValidationResult invalid(String reason) {
		return new ValidationResult(false, null, reason);
	}
}
