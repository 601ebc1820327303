package com.programmersdiary.cronwarden.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.programmersdiary.cronwarden.entry.ReportEntry;
import com.programmersdiary.cronwarden.entry.ScanEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

@Repository
public class JsonFileEntryStore implements EntryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileEntryStore.class);
    private static final TypeReference<Map<String, ScanEntry>> SCAN_TABLE = new TypeReference<>() {};
    private static final TypeReference<Map<String, ReportEntry>> REPORT_TABLE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path scanFile;
    private final Path reportFile;

    public JsonFileEntryStore(
            @Value("${cronwarden.data-dir:${user.home}/.cronwarden}") String dataDir,
            @Value("${cronwarden.store.scan-file:crontab.json}") String scanFileName,
            @Value("${cronwarden.store.report-file:reportsCrontab.json}") String reportFileName) {
        this.scanFile = Path.of(dataDir, scanFileName);
        this.reportFile = Path.of(dataDir, reportFileName);
    }

    @Override
    public Map<String, ScanEntry> loadScanEntries() {
        return read(scanFile, SCAN_TABLE);
    }

    @Override
    public void saveScanEntries(Map<String, ScanEntry> entries) {
        write(scanFile, entries);
    }

    @Override
    public Map<String, ReportEntry> loadReportEntries() {
        return read(reportFile, REPORT_TABLE);
    }

    @Override
    public void saveReportEntries(Map<String, ReportEntry> entries) {
        write(reportFile, entries);
    }

    private <E> Map<String, E> read(Path file, TypeReference<Map<String, E>> type) {
        if (!Files.exists(file)) {
            log.info("No entries file at {}, starting with an empty table", file);
            return Map.of();
        }
        try {
            var entries = objectMapper.readValue(file.toFile(), type);
            return entries != null ? entries : Map.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read entries from " + file, e);
        }
    }

    private void write(Path file, Map<String, ?> entries) {
        try {
            Files.createDirectories(file.getParent());
            var tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), new TreeMap<>(entries));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write entries to " + file, e);
        }
    }
}
