package com.example.campuseats.domain.menu.dto;

public record RemoteValidationRequest(
	String value
) {
}
