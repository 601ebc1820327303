package com.programmersdiary.cronwarden.entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportEntry(
        @JsonProperty("team_id") String teamId,
        @JsonProperty("cron_spec") String cronSpec) implements CronEntry {

    @Override
    public String id() {
        return teamId;
    }
}
