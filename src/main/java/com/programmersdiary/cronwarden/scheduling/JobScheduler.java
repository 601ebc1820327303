package com.programmersdiary.cronwarden.scheduling;

/**
 * Background clock that fires registered jobs.
 */
public interface JobScheduler {

    /**
     * Registers the job, replacing any job already registered under the same key.
     * Jobs registered before {@link #start()} begin firing once the clock starts.
     */
    void schedule(ScheduledJob job);

    /**
     * Unregisters the job. Unknown keys are ignored.
     */
    void removeJob(JobKey key);

    void start();

    /**
     * Halts future firings and waits for actions already running. Safe to call more than once
     * and before {@link #start()}.
     */
    void stop();
}
