package com.programmersdiary.cronwarden.web;

import com.programmersdiary.cronwarden.entry.CronEntry;
import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.entry.ScanEntry;
import com.programmersdiary.cronwarden.scheduling.ScheduleOrchestrator;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class ScanEntryController {

    private final ScheduleOrchestrator orchestrator;

    public ScanEntryController(ScheduleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/entries")
    public List<CronEntry> list() {
        return orchestrator.getEntries(CronType.SCAN);
    }

    @PostMapping("/entries")
    public void bulkCreate(@RequestBody List<CreateSettingRequest> settings) {
        var entries = settings.stream()
                .map(s -> new ScanEntry(s.programId(), s.teamId(), s.str()))
                .toList();
        var overwrite = settings.stream()
                .map(CreateSettingRequest::overwrite)
                .toList();
        orchestrator.bulkCreate(CronType.SCAN, entries, overwrite);
    }

    @GetMapping("/entries/{programId}")
    public CronEntry get(@PathVariable String programId) {
        return orchestrator.getEntryById(CronType.SCAN, programId);
    }

    @DeleteMapping("/entries/{programId}")
    public void remove(@PathVariable String programId) {
        orchestrator.removeEntry(CronType.SCAN, programId);
    }

    @PostMapping("/settings/{programId}/{teamId}")
    public void save(@PathVariable String programId, @PathVariable String teamId,
                     @RequestBody CronStringRequest request) {
        orchestrator.saveEntry(CronType.SCAN, new ScanEntry(programId, teamId, request.str()));
    }
}
