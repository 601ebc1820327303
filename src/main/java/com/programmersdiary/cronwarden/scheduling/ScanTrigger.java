package com.programmersdiary.cronwarden.scheduling;

/**
 * Starts a scan of a program on behalf of a team. Implementations own their retry policy.
 */
public interface ScanTrigger {

    void triggerScan(String programId, String teamId);
}
