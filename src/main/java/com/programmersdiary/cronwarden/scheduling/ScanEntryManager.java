package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.entry.ScanEntry;
import com.programmersdiary.cronwarden.store.EntryStore;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ScanEntryManager extends EntryManager<ScanEntry> {

    private final EntryStore store;
    private final ScanTrigger scanTrigger;

    public ScanEntryManager(EntryStore store, ScanTrigger scanTrigger) {
        super(CronType.SCAN, ScanEntry.class);
        this.store = store;
        this.scanTrigger = scanTrigger;
    }

    @Override
    protected Map<String, ScanEntry> read() {
        return store.loadScanEntries();
    }

    @Override
    protected void write(Map<String, ScanEntry> entries) {
        store.saveScanEntries(entries);
    }

    @Override
    protected Runnable jobFor(ScanEntry entry) {
        return new ScanJob(entry.programId(), entry.teamId(), scanTrigger);
    }
}
