package com.serge.community.service;

public class MailDispatchException extends RuntimeException {
    public MailDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
