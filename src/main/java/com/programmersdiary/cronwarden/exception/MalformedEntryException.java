package com.programmersdiary.cronwarden.exception;

import com.programmersdiary.cronwarden.entry.CronType;

/**
 * An entry of one variant was submitted under the other variant's type.
 */
public class MalformedEntryException extends CronwardenException {

    public MalformedEntryException(CronType type, Object entry) {
        super("Entry " + entry + " is not a valid " + type + " entry");
    }
}
