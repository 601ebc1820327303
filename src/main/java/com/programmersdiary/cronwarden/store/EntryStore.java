package com.programmersdiary.cronwarden.store;

import com.programmersdiary.cronwarden.entry.ReportEntry;
import com.programmersdiary.cronwarden.entry.ScanEntry;

import java.util.Map;

/**
 * Durable home of the two entry tables. Each table is read and written as a whole.
 * A table that was never written loads as an empty map.
 */
public interface EntryStore {

    Map<String, ScanEntry> loadScanEntries();

    void saveScanEntries(Map<String, ScanEntry> entries);

    Map<String, ReportEntry> loadReportEntries();

    void saveReportEntries(Map<String, ReportEntry> entries);
}
