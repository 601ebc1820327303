package com.programmersdiary.cronwarden.exception;

/**
 * The cron spec of an entry cannot be turned into a recurrence rule.
 */
public class MalformedScheduleException extends CronwardenException {

    private final String cronSpec;

    public MalformedScheduleException(String cronSpec, String reason) {
        super("Malformed schedule '" + cronSpec + "': " + reason);
        this.cronSpec = cronSpec;
    }

    public String cronSpec() {
        return cronSpec;
    }
}
