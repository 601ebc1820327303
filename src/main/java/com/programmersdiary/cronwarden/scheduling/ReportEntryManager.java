package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.entry.ReportEntry;
import com.programmersdiary.cronwarden.store.EntryStore;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ReportEntryManager extends EntryManager<ReportEntry> {

    private final EntryStore store;
    private final ReportSender reportSender;

    public ReportEntryManager(EntryStore store, ReportSender reportSender) {
        super(CronType.REPORT, ReportEntry.class);
        this.store = store;
        this.reportSender = reportSender;
    }

    @Override
    protected Map<String, ReportEntry> read() {
        return store.loadReportEntries();
    }

    @Override
    protected void write(Map<String, ReportEntry> entries) {
        store.saveReportEntries(entries);
    }

    @Override
    protected Runnable jobFor(ReportEntry entry) {
        return new ReportJob(entry.teamId(), reportSender);
    }
}
