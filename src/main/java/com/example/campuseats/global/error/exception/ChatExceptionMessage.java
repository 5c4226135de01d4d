package com.example.campuseats.global.error.exception;

import static org.springframework.http.HttpStatus.*;

import org.springframework.http.HttpStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ChatExceptionMessage implements ExceptionMessage {

	SESSION_BUSY(CONFLICT, "A reply for this session is still streaming. Wait for it to finish or stop it first."),
	SESSION_NOT_FOUND(NOT_FOUND, "No session exists with this id."),
	GENERATION_FAILED(BAD_GATEWAY, "The language model failed to produce a reply."),
	TOOL_UNAVAILABLE(SERVICE_UNAVAILABLE, "The menu service could not be reached."),
	ORDER_PERSIST_FAILED(INTERNAL_SERVER_ERROR, "The order could not be saved."),
	PROMPT_NOT_LOADED(INTERNAL_SERVER_ERROR, "The system prompt could not be loaded."),
	;

	private final HttpStatus httpStatus;
	private final String message;
}
