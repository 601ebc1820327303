package com.programmersdiary.cronwarden.exception;

import com.programmersdiary.cronwarden.entry.CronType;

public class ScheduleNotFoundException extends CronwardenException {

    public ScheduleNotFoundException(CronType type, String id) {
        super("No " + type + " schedule found for id '" + id + "'");
    }
}
