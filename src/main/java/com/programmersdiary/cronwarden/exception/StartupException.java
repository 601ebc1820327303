package com.programmersdiary.cronwarden.exception;

/**
 * A persisted entry could not be scheduled while booting. Aborts startup.
 */
public class StartupException extends CronwardenException {

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
