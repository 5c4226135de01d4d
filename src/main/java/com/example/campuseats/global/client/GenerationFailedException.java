package com.example.campuseats.global.client;

import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

public class GenerationFailedException extends BusinessException {

	public GenerationFailedException(Throwable cause) {
		super(ChatExceptionMessage.GENERATION_FAILED, cause);
	}
}
