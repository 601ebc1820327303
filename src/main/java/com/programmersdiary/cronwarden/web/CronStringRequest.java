package com.programmersdiary.cronwarden.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronStringRequest(@JsonProperty("str") @JsonAlias("cron_spec") String str) {
}
