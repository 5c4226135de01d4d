package com.example.campuseats.domain.menu.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MenuItem(
	String name,
	BigDecimal price
) {
}
