package com.programmersdiary.cronwarden.platform;

import com.programmersdiary.cronwarden.exception.CronwardenException;
import org.springframework.http.HttpStatusCode;

/**
 * The platform answered with something other than 201 Created.
 */
public class PlatformRequestException extends CronwardenException {

    private final HttpStatusCode status;

    public PlatformRequestException(HttpStatusCode status, String body) {
        super("Platform responded " + status.value() + ": " + body);
        this.status = status;
    }

    public HttpStatusCode status() {
        return status;
    }

    /**
     * Server side failures may succeed on a later attempt; anything else will not.
     */
    public boolean isRetryable() {
        return status.is5xxServerError();
    }
}
