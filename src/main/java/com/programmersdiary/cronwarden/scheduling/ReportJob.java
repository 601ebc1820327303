package com.programmersdiary.cronwarden.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

record ReportJob(String teamId, ReportSender reportSender) implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReportJob.class);

    @Override
    public void run() {
        log.info("Executing report job '{}'", teamId);
        try {
            reportSender.sendReport(teamId);
        } catch (Exception e) {
            log.error("Report job '{}' failed: {}", teamId, e.getMessage(), e);
            return;
        }
        log.info("Executed report job '{}'", teamId);
    }
}
