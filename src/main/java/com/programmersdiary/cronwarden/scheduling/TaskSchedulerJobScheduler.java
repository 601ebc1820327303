package com.programmersdiary.cronwarden.scheduling;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link JobScheduler} on top of a {@link ThreadPoolTaskScheduler}. The scheduler threads only
 * dispatch; actions run on a separate worker pool so a slow action does not hold up the clock.
 * The worker pool hands every firing straight to a thread and grows past its core size instead
 * of queueing, so busy or hung actions never delay other due jobs.
 */
@Component
public class TaskSchedulerJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerJobScheduler.class);

    private enum State { NEW, RUNNING, STOPPED }

    private final int poolSize;
    private final int workerPoolSize;
    private final int awaitTerminationSeconds;
    private final Map<JobKey, ScheduledJob> jobs = new LinkedHashMap<>();
    private final Map<JobKey, ScheduledFuture<?>> activeFutures = new HashMap<>();

    private ThreadPoolTaskScheduler clock;
    private ThreadPoolTaskExecutor workers;
    private State state = State.NEW;

    public TaskSchedulerJobScheduler(
            @Value("${cronwarden.scheduler.pool-size:2}") int poolSize,
            @Value("${cronwarden.scheduler.worker-pool-size:8}") int workerPoolSize,
            @Value("${cronwarden.scheduler.await-termination-seconds:60}") int awaitTerminationSeconds) {
        this.poolSize = poolSize;
        this.workerPoolSize = workerPoolSize;
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }

    @Override
    public synchronized void schedule(ScheduledJob job) {
        var replaced = jobs.put(job.key(), job) != null;
        cancel(job.key());
        if (state == State.RUNNING) {
            arm(job);
        }
        log.info("{} job '{}'", replaced ? "Rescheduled" : "Scheduled", job.key());
    }

    @Override
    public synchronized void removeJob(JobKey key) {
        if (jobs.remove(key) != null) {
            log.info("Removed job '{}'", key);
        }
        cancel(key);
    }

    @Override
    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Job scheduler cannot be started from state " + state);
        }
        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(workerPoolSize);
        workers.setMaxPoolSize(Integer.MAX_VALUE);
        workers.setQueueCapacity(0);
        workers.setThreadNamePrefix("cron-job-");
        workers.setWaitForTasksToCompleteOnShutdown(true);
        workers.setAwaitTerminationSeconds(awaitTerminationSeconds);
        workers.initialize();

        clock = new ThreadPoolTaskScheduler();
        clock.setPoolSize(poolSize);
        clock.setThreadNamePrefix("cron-clock-");
        clock.setErrorHandler(t -> log.error("Dispatching job failed", t));
        clock.initialize();

        state = State.RUNNING;
        jobs.values().forEach(this::arm);
        log.info("Job scheduler started with {} jobs", jobs.size());
    }

    @PreDestroy
    @Override
    public synchronized void stop() {
        if (state == State.RUNNING) {
            activeFutures.values().forEach(f -> f.cancel(false));
            activeFutures.clear();
            clock.shutdown();
            workers.shutdown();
            log.info("Job scheduler stopped");
        }
        state = State.STOPPED;
    }

    synchronized int size() {
        return jobs.size();
    }

    synchronized boolean isArmed(JobKey key) {
        return activeFutures.containsKey(key);
    }

    private void arm(ScheduledJob job) {
        var future = clock.schedule(() -> dispatch(job), job.trigger());
        if (future == null) {
            log.warn("Job '{}' has no upcoming executions", job.key());
            return;
        }
        activeFutures.put(job.key(), future);
    }

    private void dispatch(ScheduledJob job) {
        try {
            workers.execute(job.action());
        } catch (TaskRejectedException e) {
            log.warn("Job '{}' was not run: {}", job.key(), e.getMessage());
        }
    }

    private void cancel(JobKey key) {
        var future = activeFutures.remove(key);
        if (future != null) {
            future.cancel(false);
        }
    }
}
