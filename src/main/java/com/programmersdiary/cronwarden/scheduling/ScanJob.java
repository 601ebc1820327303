package com.programmersdiary.cronwarden.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

record ScanJob(String programId, String teamId, ScanTrigger scanTrigger) implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScanJob.class);

    @Override
    public void run() {
        log.info("Executing scan job '{}' for team '{}'", programId, teamId);
        try {
            scanTrigger.triggerScan(programId, teamId);
        } catch (Exception e) {
            log.error("Scan job '{}' failed: {}", programId, e.getMessage(), e);
            return;
        }
        log.info("Executed scan job '{}'", programId);
    }
}
