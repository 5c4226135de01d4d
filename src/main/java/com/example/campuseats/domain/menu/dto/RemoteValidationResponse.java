package com.example.campuseats.domain.menu.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteValidationResponse(
	boolean valid,
	String value,
	String reason
) {
}
