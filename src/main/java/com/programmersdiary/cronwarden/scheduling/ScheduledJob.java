package com.programmersdiary.cronwarden.scheduling;

import org.springframework.scheduling.Trigger;

public record ScheduledJob(JobKey key, Trigger trigger, Runnable action) {
}
