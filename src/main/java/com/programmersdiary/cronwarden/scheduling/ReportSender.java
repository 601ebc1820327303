package com.programmersdiary.cronwarden.scheduling;

/**
 * Requests generation and delivery of a team's digest report. Implementations own their retry policy.
 */
public interface ReportSender {

    void sendReport(String teamId);
}
