package com.programmersdiary.cronwarden.web;

import com.programmersdiary.cronwarden.entry.CronType;
import com.programmersdiary.cronwarden.entry.ReportEntry;
import com.programmersdiary.cronwarden.exception.MalformedEntryException;
import com.programmersdiary.cronwarden.exception.ScheduleNotFoundException;
import com.programmersdiary.cronwarden.scheduling.ScheduleOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ReportEntryController.class)
class ReportEntryControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ScheduleOrchestrator orchestrator;

    @Test
    void listsEntries() throws Exception {
        when(orchestrator.getEntries(CronType.REPORT)).thenReturn(List.of(new ReportEntry("t1", "0 8 * * 1")));

        mvc.perform(get("/report/entries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].team_id").value("t1"))
                .andExpect(jsonPath("$[0].cron_spec").value("0 8 * * 1"))
                .andExpect(jsonPath("$[0].program_id").doesNotExist());
    }

    @Test
    void unknownEntryIsNotFound() throws Exception {
        when(orchestrator.getEntryById(CronType.REPORT, "t9"))
                .thenThrow(new ScheduleNotFoundException(CronType.REPORT, "t9"));

        mvc.perform(get("/report/entries/t9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void savesSettingForTeam() throws Exception {
        mvc.perform(post("/report/settings/t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"str\":\"@weekly\"}"))
                .andExpect(status().isOk());

        verify(orchestrator).saveEntry(CronType.REPORT, new ReportEntry("t1", "@weekly"));
    }

    @Test
    void malformedEntryIsUnprocessable() throws Exception {
        doThrow(new MalformedEntryException(CronType.REPORT, "entry"))
                .when(orchestrator).saveEntry(eq(CronType.REPORT), any());

        mvc.perform(post("/report/settings/t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"str\":\"@weekly\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void bulkCreateIgnoresProgramIds() throws Exception {
        mvc.perform(post("/report/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"str\":\"@daily\",\"team_id\":\"t1\",\"program_id\":\"p1\",\"overwrite\":true}]"))
                .andExpect(status().isOk());

        verify(orchestrator).bulkCreate(CronType.REPORT, List.of(new ReportEntry("t1", "@daily")), List.of(true));
    }

    @Test
    void deletesEntry() throws Exception {
        mvc.perform(delete("/report/entries/t1"))
                .andExpect(status().isOk());

        verify(orchestrator).removeEntry(CronType.REPORT, "t1");
    }
}
