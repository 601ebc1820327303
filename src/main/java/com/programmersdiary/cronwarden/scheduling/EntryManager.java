package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.entry.CronEntry;
import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.exception.MalformedEntryException;
import com.programmersdiary.cronwarden.exception.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the in-memory table of one entry type. Writers hold the write lock across
 * mutate-then-persist, so readers never see a table that differs from what was last handed
 * to the store. A failed persist leaves the mutation in memory.
 */
public abstract class EntryManager<E extends CronEntry> {

    private static final Logger log = LoggerFactory.getLogger(EntryManager.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CronType type;
    private final Class<E> entryType;
    private Map<String, E> entries = new HashMap<>();

    protected EntryManager(CronType type, Class<E> entryType) {
        this.type = type;
        this.entryType = entryType;
    }

    public CronType type() {
        return type;
    }

    protected abstract Map<String, E> read();

    protected abstract void write(Map<String, E> entries);

    protected abstract Runnable jobFor(E entry);

    /**
     * Narrows an incoming entry to this manager's variant.
     */
    E accept(CronEntry entry) {
        if (!entryType.isInstance(entry)) {
            throw new MalformedEntryException(type, entry);
        }
        if (entry.id() == null || entry.id().isBlank()) {
            throw new MalformedEntryException(type, entry);
        }
        return entryType.cast(entry);
    }

    /**
     * Replaces the table with the persisted one and returns its entries.
     */
    List<E> load() {
        var persisted = read();
        lock.writeLock().lock();
        try {
            var table = new HashMap<String, E>();
            persisted.forEach((key, entry) -> {
                if (entry == null) {
                    return;
                }
                if (entry.id() == null || entry.id().isBlank()) {
                    log.warn("Skipping persisted {} entry under key '{}': it has no id", type, key);
                    return;
                }
                if (!key.equals(entry.id())) {
                    log.warn("Persisted {} entry under key '{}' has id '{}', keeping it under its id",
                            type, key, entry.id());
                }
                table.put(entry.id(), entry);
            });
            entries = table;
            return List.copyOf(table.values());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Upserts every pending entry, except those whose id already exists and that do not ask to
     * overwrite, then persists the whole table. Returns the entries that were written.
     */
    List<E> bulkUpsert(Collection<PendingEntry<E>> pending) {
        lock.writeLock().lock();
        try {
            var snapshot = new HashMap<>(entries);
            var applied = new ArrayList<E>();
            for (var item : pending) {
                var entry = item.entry();
                if (snapshot.containsKey(entry.id()) && !item.overwrite()) {
                    log.info("Keeping existing {} entry '{}', overwrite not requested", type, entry.id());
                    continue;
                }
                snapshot.put(entry.id(), entry);
                applied.add(entry);
            }
            entries = snapshot;
            write(Map.copyOf(snapshot));
            return applied;
        } finally {
            lock.writeLock().unlock();
        }
    }

    void upsert(E entry) {
        lock.writeLock().lock();
        try {
            entries.put(entry.id(), entry);
            write(Map.copyOf(entries));
        } finally {
            lock.writeLock().unlock();
        }
    }

    void remove(String id) {
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(id)) {
                throw new ScheduleNotFoundException(type, id);
            }
            entries.remove(id);
            write(Map.copyOf(entries));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<E> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public E entry(String id) {
        lock.readLock().lock();
        try {
            var entry = entries.get(id);
            if (entry == null) {
                throw new ScheduleNotFoundException(type, id);
            }
            return entry;
        } finally {
            lock.readLock().unlock();
        }
    }

    record PendingEntry<E>(E entry, boolean overwrite) {
    }
}
