package com.programmersdiary.cronwarden.whitelist;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Team allow-list for one cron type. A disabled whitelist allows every team.
 */
public record WhitelistConfig(boolean enabled, Set<String> teams) {

    public WhitelistConfig {
        teams = teams != null ? Set.copyOf(teams) : Set.of();
    }

    public static WhitelistConfig disabled() {
        return new WhitelistConfig(false, Set.of());
    }

    public static WhitelistConfig of(boolean enabled, Collection<String> teams) {
        if (teams == null) {
            return new WhitelistConfig(enabled, Set.of());
        }
        return new WhitelistConfig(enabled, teams.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet()));
    }

    public boolean allows(String teamId) {
        return !enabled || (teamId != null && teams.contains(teamId));
    }
}
