package com.programmersdiary.cronwarden.whitelist;

import com.programmersdiary.cronwarden.entry.CronType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a team's entry may have a live job. Only consulted when a job is
 * (re)registered, so a config change takes effect on the next write or restart.
 */
@Component
public class WhitelistPolicy {

    private final WhitelistConfig scan;
    private final WhitelistConfig report;

    @Autowired
    public WhitelistPolicy(
            @Value("${cronwarden.whitelist.scan.enabled:false}") boolean scanEnabled,
            @Value("${cronwarden.whitelist.scan.teams:}") List<String> scanTeams,
            @Value("${cronwarden.whitelist.report.enabled:false}") boolean reportEnabled,
            @Value("${cronwarden.whitelist.report.teams:}") List<String> reportTeams) {
        this(WhitelistConfig.of(scanEnabled, scanTeams), WhitelistConfig.of(reportEnabled, reportTeams));
    }

    public WhitelistPolicy(WhitelistConfig scan, WhitelistConfig report) {
        this.scan = scan;
        this.report = report;
    }

    public static WhitelistPolicy allowAll() {
        return new WhitelistPolicy(WhitelistConfig.disabled(), WhitelistConfig.disabled());
    }

    public boolean isAllowed(CronType type, String teamId) {
        return configFor(type).allows(teamId);
    }

    public WhitelistConfig configFor(CronType type) {
        return switch (type) {
            case SCAN -> scan;
            case REPORT -> report;
        };
    }
}
