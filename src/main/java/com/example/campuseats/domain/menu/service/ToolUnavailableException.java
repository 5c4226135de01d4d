package com.example.campuseats.domain.menu.service;

import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

public class ToolUnavailableException extends BusinessException {

    public ToolUnavailableException(Throwable cause) {
        super(ChatExceptionMessage.TOOL_UNAVAILABLE, cause);
    }
}
