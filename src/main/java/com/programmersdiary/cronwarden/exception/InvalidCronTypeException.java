package com.programmersdiary.cronwarden.exception;

public class InvalidCronTypeException extends CronwardenException {

    public InvalidCronTypeException(Object type) {
        super("Invalid cron type: " + type);
    }
}
