package com.example.campuseats.domain.restaurant.dto;

import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RestaurantHours(
	String name,
	@JsonFormat(pattern = "HH:mm") LocalTime open,
	@JsonFormat(pattern = "HH:mm") LocalTime close
) {
	/**
	 * Both ends inclusive. A closing time before the opening time means the restaurant is open past midnight.
	 */
	public boolean isOpenAt(LocalTime time) {
		if (!close.isBefore(open)) {
			return !time.isBefore(open) && !time.isAfter(close);
		}
		return !time.isBefore(open) || !time.isAfter(close);
	}

	public String describe() {
		return String.format("%s (Open: %s - %s)", name, open, close);
	}
}
