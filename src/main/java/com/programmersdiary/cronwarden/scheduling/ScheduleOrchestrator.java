package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.entry.CronEntry;
import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.exception.InvalidCronTypeException;
import com.programmersdiary.cronwarden.exception.MalformedScheduleException;
import com.programmersdiary.cronwarden.exception.StartupException;
import com.programmersdiary.cronwarden.whitelist.WhitelistPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.Trigger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Entry point for every schedule operation. Keeps the scan and report tables, their persisted
 * copies and the live jobs in step.
 * <p>
 * Job registration always follows a successful persist and happens outside the table lock, so
 * a reader may briefly see a table change before the matching job change.
 */
@Service
public class ScheduleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleOrchestrator.class);

    private final ScanEntryManager scanEntries;
    private final ReportEntryManager reportEntries;
    private final WhitelistPolicy whitelist;
    private final JobScheduler jobScheduler;

    public ScheduleOrchestrator(ScanEntryManager scanEntries,
                                ReportEntryManager reportEntries,
                                WhitelistPolicy whitelist,
                                JobScheduler jobScheduler) {
        this.scanEntries = scanEntries;
        this.reportEntries = reportEntries;
        this.whitelist = whitelist;
        this.jobScheduler = jobScheduler;
    }

    /**
     * Loads both tables, schedules every whitelisted entry and starts the clock. Any persisted
     * entry with an unparseable cron spec aborts the whole start.
     */
    @PostConstruct
    public void start() {
        var jobs = new ArrayList<ScheduledJob>();
        jobs.addAll(restore(scanEntries));
        jobs.addAll(restore(reportEntries));
        jobs.forEach(jobScheduler::schedule);
        jobScheduler.start();
        log.info("Started with {} live jobs", jobs.size());
    }

    @PreDestroy
    public void stop() {
        jobScheduler.stop();
        log.info("Stopped");
    }

    /**
     * Upserts a batch of entries. {@code overwrite} runs parallel to {@code entries}; an entry
     * whose id already exists is only replaced when its flag is set. When an id repeats inside
     * the batch the last occurrence wins. Invalid cron specs reject the whole batch untouched.
     */
    public void bulkCreate(CronType type, List<? extends CronEntry> entries, List<Boolean> overwrite) {
        bulkCreate(managerFor(type), entries, overwrite);
    }

    /**
     * Upserts a single entry, replacing any entry with the same id.
     */
    public void saveEntry(CronType type, CronEntry entry) {
        saveEntry(managerFor(type), entry);
    }

    public void removeEntry(CronType type, String id) {
        var manager = managerFor(type);
        manager.remove(id);
        jobScheduler.removeJob(new JobKey(type, id));
    }

    public List<CronEntry> getEntries(CronType type) {
        return List.copyOf(managerFor(type).entries());
    }

    public CronEntry getEntryById(CronType type, String id) {
        return managerFor(type).entry(id);
    }

    private <E extends CronEntry> List<ScheduledJob> restore(EntryManager<E> manager) {
        var jobs = new ArrayList<ScheduledJob>();
        var loaded = manager.load();
        for (var entry : loaded) {
            if (!whitelist.isAllowed(manager.type(), entry.teamId())) {
                log.debug("Team '{}' not whitelisted, {} entry '{}' loaded without a job",
                        entry.teamId(), manager.type(), entry.id());
                continue;
            }
            Trigger trigger;
            try {
                trigger = CronSchedules.parse(entry.cronSpec());
            } catch (MalformedScheduleException e) {
                throw new StartupException("Cannot schedule persisted " + manager.type()
                        + " entry '" + entry.id() + "'", e);
            }
            jobs.add(new ScheduledJob(new JobKey(manager.type(), entry.id()), trigger, manager.jobFor(entry)));
        }
        log.info("Loaded {} {} entries, {} to schedule", loaded.size(), manager.type(), jobs.size());
        return jobs;
    }

    private <E extends CronEntry> void bulkCreate(EntryManager<E> manager,
                                                  List<? extends CronEntry> entries,
                                                  List<Boolean> overwrite) {
        var parsed = new ArrayList<Trigger>(entries.size());
        for (var entry : entries) {
            parsed.add(CronSchedules.parse(entry.cronSpec()));
        }
        var pending = new LinkedHashMap<String, EntryManager.PendingEntry<E>>();
        var triggers = new HashMap<String, Trigger>();
        for (int i = 0; i < entries.size(); i++) {
            var entry = manager.accept(entries.get(i));
            pending.remove(entry.id());
            pending.put(entry.id(), new EntryManager.PendingEntry<>(entry, Boolean.TRUE.equals(overwrite.get(i))));
            triggers.put(entry.id(), parsed.get(i));
        }

        var applied = manager.bulkUpsert(pending.values());
        for (var entry : applied) {
            register(manager, entry, triggers.get(entry.id()));
        }
        log.info("Bulk {} request: {} received, {} written", manager.type(), entries.size(), applied.size());
    }

    private <E extends CronEntry> void saveEntry(EntryManager<E> manager, CronEntry entry) {
        var trigger = CronSchedules.parse(entry.cronSpec());
        var accepted = manager.accept(entry);
        manager.upsert(accepted);
        register(manager, accepted, trigger);
    }

    private <E extends CronEntry> void register(EntryManager<E> manager, E entry, Trigger trigger) {
        if (!whitelist.isAllowed(manager.type(), entry.teamId())) {
            log.info("Team '{}' not whitelisted, {} entry '{}' saved without a job",
                    entry.teamId(), manager.type(), entry.id());
            return;
        }
        jobScheduler.schedule(new ScheduledJob(new JobKey(manager.type(), entry.id()), trigger, manager.jobFor(entry)));
    }

    private EntryManager<?> managerFor(CronType type) {
        if (type == null) {
            throw new InvalidCronTypeException(null);
        }
        return switch (type) {
            case SCAN -> scanEntries;
            case REPORT -> reportEntries;
        };
    }
}
