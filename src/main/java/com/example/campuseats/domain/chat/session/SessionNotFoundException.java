package com.example.campuseats.domain.chat.session;

import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

public class SessionNotFoundException extends BusinessException {

    public SessionNotFoundException() {
        super(ChatExceptionMessage.SESSION_NOT_FOUND);
    }
}
