package com.di.extractflow.controller;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.aggregation.JobCollectionStore;
import com.di.extractflow.config.ExtractFlowProperties;
import com.di.extractflow.exception.GlobalExceptionHandler;
import com.di.extractflow.partition.DatasetFixtures;
import com.di.extractflow.partition.PartitioningEngine;
import com.di.extractflow.storage.LocalObjectStorageClient;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("PipelineController Tests")
class PipelineControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tmp;

    private LocalObjectStorageClient storage;
    private JobCollectionStore jobStore;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ExtractFlowProperties properties = new ExtractFlowProperties();
        properties.setWorkDir(tmp.resolve("work").toString());
        storage = new LocalObjectStorageClient(tmp.resolve("storage"));
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        PartitioningEngine engine = new PartitioningEngine(
                new StorageTransfer(storage, 2, properties.getExecutor().getResultTimeout()),
                properties, mapper, new PipelineMetrics(new SimpleMeterRegistry()));
        jobStore = new JobCollectionStore(tmp.resolve("jobs.json"), mapper);

        // /run is covered end to end by the orchestrator tests
        mvc = MockMvcBuilders.standaloneSetup(new PipelineController(engine, null, jobStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static CompletedStep run(int memoryMb, long durationMs) {
        return CompletedStep.builder()
                .jobId("j-" + memoryMb + "-" + durationMs)
                .stepName("rebinning")
                .memoryMb(memoryMb)
                .cpusPerWorker(2)
                .workerCount(4)
                .durationMs(durationMs)
                .costUsd(durationMs * 0.000001)
                .startTime(T0)
                .endTime(T0.plusMillis(durationMs))
                .build();
    }

    // ============================================================================
    // Partitioning
    // ============================================================================

    @Test
    @DisplayName("POST /api/pipeline/partition returns the created partitions")
    void testPartition() throws Exception {
        DatasetFixtures.storeDataset(storage, tmp.resolve("scratch"), "extract", "datasets/obs", "obs1", 100, 0.0);

        mvc.perform(post("/api/pipeline/partition")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"container":"extract","sourceKey":"datasets/obs","partitions":4,"destinationKey":"partitions"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(true))
                .andExpect(jsonPath("$.totalRows").value(100))
                .andExpect(jsonPath("$.partitions.length()").value(4));
    }

    @Test
    @DisplayName("A partition count below one is rejected")
    void testPartitionValidation() throws Exception {
        mvc.perform(post("/api/pipeline/partition")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"container":"extract","sourceKey":"datasets/obs","partitions":0,"destinationKey":"partitions"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("A missing source maps to 502")
    void testPartitionMissingSource() throws Exception {
        mvc.perform(post("/api/pipeline/partition")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"container":"extract","sourceKey":"nothing","partitions":2,"destinationKey":"partitions"}
                                """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details.exceptionType").value("com.di.extractflow.exception.ObjectStorageException"));
    }

    // ============================================================================
    // Jobs
    // ============================================================================

    @Test
    @DisplayName("GET /api/jobs/{step} is 404 until the step has run")
    void testJobs() throws Exception {
        mvc.perform(get("/api/jobs/rebinning")).andExpect(status().isNotFound());

        jobStore.record(run(2000, 10_000L));

        mvc.perform(get("/api/jobs/rebinning"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].memoryMb").value(2000));
        mvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rebinning.length()").value(1));
    }

    @Test
    @DisplayName("GET /api/jobs/{step}/analysis reports speed-ups against the baseline")
    void testAnalysis() throws Exception {
        jobStore.record(run(2000, 10_000L));
        jobStore.record(run(4000, 5_000L));

        mvc.perform(get("/api/jobs/rebinning/analysis")
                        .param("baselineMemoryMb", "2000")
                        .param("baselineCpus", "2")
                        .param("baselineWorkers", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configurations.length()").value(2))
                .andExpect(jsonPath("$.speedUps[1].speedUp").value(2.0));

        mvc.perform(get("/api/jobs/rebinning/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.speedUps.length()").value(0));
    }
}
