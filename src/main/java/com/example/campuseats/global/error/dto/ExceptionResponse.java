package com.example.campuseats.global.error.dto;

import com.example.campuseats.global.error.exception.ExceptionMessage;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;

@Schema(description = "Error response")
@Getter
public class ExceptionResponse {

	@Schema(description = "Success flag", example = "false")
	private final boolean success;

	@Schema(description = "Error code", example = "SESSION_BUSY")
	private final String code;

	@Schema(description = "Error message")
	private final String message;

	protected ExceptionResponse(ExceptionMessage exceptionMessage) {
		this.success = false;
		this.code = exceptionMessage.name();
		this.message = exceptionMessage.getMessage();
	}

	public static ExceptionResponse fail(ExceptionMessage exceptionMessage) {
		return new ExceptionResponse(exceptionMessage);
	}
}
