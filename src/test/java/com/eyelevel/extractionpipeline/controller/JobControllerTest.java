package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.job.QueueStats;
import com.eyelevel.extractionpipeline.dto.worker.PoolStatus;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.model.JobStatus;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import com.eyelevel.extractionpipeline.service.worker.WorkerPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobQueueService jobQueueService;

    @MockBean
    private WorkerPool workerPool;

    private static Job job(JobStatus status) {
        return Job.builder()
                  .id("job-1")
                  .fileReference("/uploads/invoice.pdf")
                  .sessionId("s1")
                  .config(Map.of())
                  .status(status)
                  .createdAt(LocalDateTime.of(2024, 3, 1, 10, 0))
                  .progress(0)
                  .result(Map.of())
                  .build();
    }

    @Test
    @DisplayName("POST /api/v1/jobs queues a job and returns its id")
    void enqueue() throws Exception {
        when(jobQueueService.enqueue(eq("/uploads/invoice.pdf"), eq("s1"), any())).thenReturn("job-1");

        mockMvc.perform(post("/api/v1/jobs")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"fileReference\":\"/uploads/invoice.pdf\",\"sessionId\":\"s1\"}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.jobId").value("job-1"))
               .andExpect(jsonPath("$.statusCode").value(200));
    }

    @Test
    @DisplayName("POST /api/v1/jobs without a session id is a bad request")
    void enqueueValidation() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"fileReference\":\"/uploads/invoice.pdf\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.statusCode").value(400));
    }

    @Test
    @DisplayName("GET /api/v1/jobs/{id} returns the job or 404")
    void getJob() throws Exception {
        when(jobQueueService.get("job-1")).thenReturn(Optional.of(job(JobStatus.PENDING)));
        when(jobQueueService.get("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/jobs/job-1"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.sessionId").value("s1"));
        mockMvc.perform(get("/api/v1/jobs/missing"))
               .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE of a processing job is a conflict, of an unknown job a 404")
    void cancel() throws Exception {
        when(jobQueueService.cancel("job-1")).thenReturn(false);
        when(jobQueueService.get("job-1")).thenReturn(Optional.of(job(JobStatus.PROCESSING)));
        when(jobQueueService.cancel("missing")).thenReturn(false);
        when(jobQueueService.get("missing")).thenReturn(Optional.empty());
        when(jobQueueService.cancel("job-2")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/jobs/job-1")).andExpect(status().isConflict());
        mockMvc.perform(delete("/api/v1/jobs/missing")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/jobs/job-2")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("GET /api/v1/jobs/stats returns queue statistics")
    void stats() throws Exception {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        counts.put(JobStatus.PENDING, 3L);
        when(jobQueueService.stats()).thenReturn(new QueueStats(3, 3, counts));

        mockMvc.perform(get("/api/v1/jobs/stats"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.queueLength").value(3));
    }

    @Test
    @DisplayName("PUT /api/v1/jobs/workers scales the pool")
    void scaleWorkers() throws Exception {
        when(workerPool.poolStatus()).thenReturn(new PoolStatus(4, true, List.of()));

        mockMvc.perform(put("/api/v1/jobs/workers").param("size", "4"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.desiredWorkers").value(4));
        verify(workerPool).scaleTo(4);
    }

    @Test
    @DisplayName("scaling rejected by the pool surfaces as a bad request")
    void scaleWorkersRejected() throws Exception {
        doThrow(new BadRequestException("Worker count must not be negative.")).when(workerPool).scaleTo(-1);

        mockMvc.perform(put("/api/v1/jobs/workers").param("size", "-1"))
               .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /api/v1/jobs requires a session id")
    void listRequiresSession() throws Exception {
        when(jobQueueService.findBySession(anyString())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/jobs")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/jobs").param("sessionId", "s1")).andExpect(status().isOk());
    }
}
