package com.example.campuseats.domain.order.service;

import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

public class OrderPersistException extends BusinessException {

    public OrderPersistException(Throwable cause) {
        super(ChatExceptionMessage.ORDER_PERSIST_FAILED, cause);
    }
}
