package com.programmersdiary.cronwarden.exception;

public class CronwardenException extends RuntimeException {

    public CronwardenException(String message) {
        super(message);
    }

    public CronwardenException(String message, Throwable cause) {
        super(message, cause);
    }
}
