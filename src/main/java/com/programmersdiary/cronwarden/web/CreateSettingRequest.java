package com.programmersdiary.cronwarden.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateSettingRequest(
        @JsonProperty("str") @JsonAlias("cron_spec") String str,
        @JsonProperty("program_id") String programId,
        @JsonProperty("team_id") String teamId,
        @JsonProperty("overwrite") boolean overwrite) {
}
