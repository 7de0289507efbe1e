package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.export.DownloadResult;
import com.eyelevel.extractionpipeline.model.CompressionType;
import com.eyelevel.extractionpipeline.model.DownloadDenialReason;
import com.eyelevel.extractionpipeline.model.ExportJob;
import com.eyelevel.extractionpipeline.model.ExportStatus;
import com.eyelevel.extractionpipeline.service.export.ExportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExportController.class)
class ExportControllerTest {

    @TempDir
    Path tempDir;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExportService exportService;

    private static ExportJob exportJob(ExportStatus status) {
        ExportJob job = new ExportJob();
        job.setJobId("exp-1");
        job.setSessionId("s1");
        job.setFilename("march");
        job.setStatus(status);
        job.setCreatedAt(LocalDateTime.of(2024, 3, 1, 10, 0));
        job.setTotalRecords(10);
        job.setProcessedRecords(status == ExportStatus.COMPLETED ? 10 : 0);
        job.setArtifactPath(Path.of("/exports/raw/secret.csv"));
        return job;
    }

    @Test
    @DisplayName("POST /api/v1/exports creates an export for a session")
    void createExport() throws Exception {
        when(exportService.createExportForSession("s1", "march", CompressionType.GZIP, false, true))
                .thenReturn("exp-1");
        when(exportService.getStatus("exp-1")).thenReturn(Optional.of(exportJob(ExportStatus.COMPLETED)));

        mockMvc.perform(post("/api/v1/exports")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"sessionId\":\"s1\",\"filename\":\"march\",\"compression\":\"GZIP\","
                                                 + "\"synchronous\":true}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.jobId").value("exp-1"))
               .andExpect(jsonPath("$.response.progressPercentage").value(100.0))
               .andExpect(jsonPath("$.response.artifactPath").doesNotExist());
    }

    @Test
    @DisplayName("DELETE of a finished export is a conflict")
    void cancelFinishedExport() throws Exception {
        when(exportService.cancel("exp-1")).thenReturn(false);
        when(exportService.getStatus("exp-1")).thenReturn(Optional.of(exportJob(ExportStatus.COMPLETED)));

        mockMvc.perform(delete("/api/v1/exports/exp-1")).andExpect(status().isConflict());
    }

    @Test
    @DisplayName("download-info for an export without a link is a 404")
    void downloadInfoMissing() throws Exception {
        when(exportService.getDownloadInfo("exp-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/exports/exp-1/download-info")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("an authorized token streams the file as an attachment")
    void downloadStreamsFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("march.csv"), "Id\n1\n");
        when(exportService.download("tok")).thenReturn(DownloadResult.granted(file));

        mockMvc.perform(get("/api/v1/downloads/tok"))
               .andExpect(status().isOk())
               .andExpect(header().string("Content-Disposition", containsString("attachment")))
               .andExpect(header().string("Content-Disposition", containsString("march.csv")))
               .andExpect(content().contentTypeCompatibleWith("text/csv"))
               .andExpect(content().string("Id\n1\n"));
    }

    @Test
    @DisplayName("denied downloads map to 404, 410 and 429")
    void deniedDownloads() throws Exception {
        when(exportService.download("bad")).thenReturn(DownloadResult.denied(DownloadDenialReason.INVALID_TOKEN));
        when(exportService.download("old")).thenReturn(DownloadResult.denied(DownloadDenialReason.EXPIRED));
        when(exportService.download("used")).thenReturn(DownloadResult.denied(DownloadDenialReason.LIMIT_EXCEEDED));

        mockMvc.perform(get("/api/v1/downloads/bad")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/downloads/old"))
               .andExpect(status().isGone())
               .andExpect(jsonPath("$.displayMessage").value("Download link has expired"));
        mockMvc.perform(get("/api/v1/downloads/used")).andExpect(status().isTooManyRequests());
    }
}
