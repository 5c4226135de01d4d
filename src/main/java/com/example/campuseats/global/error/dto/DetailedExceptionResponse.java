package com.example.campuseats.global.error.dto;

import java.util.List;

import com.example.campuseats.global.error.exception.ExceptionMessage;

import lombok.Getter;

@Getter
public class DetailedExceptionResponse extends ExceptionResponse {

	private final List<ErrorSpot> errorSpots;

	private DetailedExceptionResponse(ExceptionMessage exceptionMessage, List<ErrorSpot> errorSpots) {
		super(exceptionMessage);
		this.errorSpots = errorSpots;
	}

	public static DetailedExceptionResponse fail(ExceptionMessage exceptionMessage, List<ErrorSpot> errorSpots) {
		return new DetailedExceptionResponse(exceptionMessage, errorSpots);
	}

	public static DetailedExceptionResponse fail(ExceptionMessage exceptionMessage, ErrorSpot errorSpot) {
		return new DetailedExceptionResponse(exceptionMessage, List.of(errorSpot));
	}
}
