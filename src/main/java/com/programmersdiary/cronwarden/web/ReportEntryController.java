package com.programmersdiary.cronwarden.web;

import com.programmersdiary.cronwarden.entry.CronEntry;
import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.entry.ReportEntry;
import com.programmersdiary.cronwarden.scheduling.ScheduleOrchestrator;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/report")
public class ReportEntryController {

    private final ScheduleOrchestrator orchestrator;

    public ReportEntryController(ScheduleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/entries")
    public List<CronEntry> list() {
        return orchestrator.getEntries(CronType.REPORT);
    }

    @PostMapping("/entries")
    public void bulkCreate(@RequestBody List<CreateSettingRequest> settings) {
        var entries = settings.stream()
                .map(s -> new ReportEntry(s.teamId(), s.str()))
                .toList();
        var overwrite = settings.stream()
                .map(CreateSettingRequest::overwrite)
                .toList();
        orchestrator.bulkCreate(CronType.REPORT, entries, overwrite);
    }

    @GetMapping("/entries/{teamId}")
    public CronEntry get(@PathVariable String teamId) {
        return orchestrator.getEntryById(CronType.REPORT, teamId);
    }

    @DeleteMapping("/entries/{teamId}")
    public void remove(@PathVariable String teamId) {
        orchestrator.removeEntry(CronType.REPORT, teamId);
    }

    @PostMapping("/settings/{teamId}")
    public void save(@PathVariable String teamId, @RequestBody CronStringRequest request) {
        orchestrator.saveEntry(CronType.REPORT, new ReportEntry(teamId, request.str()));
    }
}
