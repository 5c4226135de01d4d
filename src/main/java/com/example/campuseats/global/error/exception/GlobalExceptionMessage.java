package com.example.campuseats.global.error.exception;

import static org.springframework.http.HttpStatus.*;

import org.springframework.http.HttpStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum GlobalExceptionMessage implements ExceptionMessage {

	INTERNAL_SERVER_ERROR_MESSAGE(INTERNAL_SERVER_ERROR, "An unknown server error occurred."),
	NO_RESOURCE_MESSAGE(NOT_FOUND, "The requested path does not exist."),
	METHOD_NOT_ALLOWED_MESSAGE(METHOD_NOT_ALLOWED, "This path does not support the request method."),
	ARGUMENT_NOT_VALID_MESSAGE(BAD_REQUEST, "The chat request is invalid: a non-blank message is required."),
	DATA_NOT_READABLE_MESSAGE(BAD_REQUEST, "The chat request body is not valid JSON."),
	UNSUPPORTED_MEDIA_TYPE_MESSAGE(UNSUPPORTED_MEDIA_TYPE, "Chat requests must be sent as application/json."),
	;

	private final HttpStatus httpStatus;
	private final String message;
}
