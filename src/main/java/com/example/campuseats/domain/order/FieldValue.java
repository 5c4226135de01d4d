package com.example.campuseats.domain.order;

public record FieldValue(
	String value,
	boolean validated
) {
}
