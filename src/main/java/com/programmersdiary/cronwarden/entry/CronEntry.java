package com.programmersdiary.cronwarden.entry;

/**
 * A persisted schedule record. Implemented only by {@link ScanEntry} and {@link ReportEntry}.
 */
public interface CronEntry {

    /**
     * Identity of the entry inside its table; also the id its job is registered under.
     */
    String id();

    String teamId();

    String cronSpec();
}
