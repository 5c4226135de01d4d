package com.example.campuseats.global.error.dto;

public record ErrorSpot(
	String field,
	String reason
) {
}
