package com.example.campuseats.domain.chat.session;

import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

public class SessionBusyException extends BusinessException {

    public SessionBusyException() {
        super(ChatExceptionMessage.SESSION_BUSY);
    }
}
