package com.programmersdiary.cronwarden.entry;

/**
 * Selects the entry table, the persistence key and the whitelist an operation works against.
 */
public enum CronType {
    SCAN, REPORT
}
