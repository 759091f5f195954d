package com.di.extractflow.config;

import com.di.extractflow.aggregation.CostModel;
import com.di.extractflow.aggregation.JobAggregator;
import com.di.extractflow.aggregation.JobCollectionStore;
import com.di.extractflow.execution.FunctionExecutor;
import com.di.extractflow.execution.LocalFunctionExecutor;
import com.di.extractflow.partition.PartitioningEngine;
import com.di.extractflow.pipeline.PipelineOrchestrator;
import com.di.extractflow.profiling.ProcFsMetricsSource;
import com.di.extractflow.profiling.ProcessMetricsSource;
import com.di.extractflow.step.CommandRunner;
import com.di.extractflow.step.ExecutionPlanner;
import com.di.extractflow.step.ImagingStepRunner;
import com.di.extractflow.step.ProcessCommandRunner;
import com.di.extractflow.step.StepRunner;
import com.di.extractflow.step.StepWorker;
import com.di.extractflow.storage.ObjectStorageClient;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Partitioning, step execution and aggregation beans.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ExecutionConfig {

    private final ExtractFlowProperties properties;

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(FunctionExecutor.class)
    public LocalFunctionExecutor functionExecutor() {
        ExtractFlowProperties.ExecutorSettings executor = properties.getExecutor();
        log.info("[CONFIG] local function executor: maxWorkers={} memory={}MB cpus={}",
                 executor.getMaxWorkers(), executor.getRuntimeMemoryMb(), executor.getCpusPerWorker());
        return new LocalFunctionExecutor(executor.getMaxWorkers(), executor.getRuntimeMemoryMb(),
                executor.getCpusPerWorker(), executor.getResultTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(CommandRunner.class)
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    @ConditionalOnMissingBean(ProcessMetricsSource.class)
    public ProcessMetricsSource processMetricsSource() {
        return new ProcFsMetricsSource();
    }

    @Bean
    public PartitioningEngine partitioningEngine(StorageTransfer transfer, ObjectMapper objectMapper,
                                                 PipelineMetrics metrics) {
        return new PartitioningEngine(transfer, properties, objectMapper, metrics);
    }

    @Bean
    public ExecutionPlanner executionPlanner(ObjectStorageClient storage) {
        return new ExecutionPlanner(storage);
    }

    @Bean
    public StepWorker stepWorker(StorageTransfer transfer, CommandRunner commandRunner,
                                 ProcessMetricsSource metricsSource) {
        log.info("[CONFIG] subprocess failure policy: {}", properties.getStep().getFailurePolicy());
        return new StepWorker(transfer, commandRunner, metricsSource, properties);
    }

    @Bean
    public JobAggregator jobAggregator(PipelineMetrics metrics) {
        return new JobAggregator(new CostModel(properties.getCost().getPerMsPerGb()), metrics);
    }

    @Bean
    public StepRunner stepRunner(FunctionExecutor executor, ExecutionPlanner planner, StepWorker worker,
                                 JobAggregator aggregator, PipelineMetrics metrics) {
        return new StepRunner(executor, planner, worker, aggregator, metrics,
                properties.getExecutor().getExtraEnv(), properties.getProfiler().isEnabled());
    }

    @Bean
    public ImagingStepRunner imagingStepRunner(FunctionExecutor executor, ExecutionPlanner planner,
                                               StorageTransfer transfer, CommandRunner commandRunner,
                                               ProcessMetricsSource metricsSource, JobAggregator aggregator,
                                               PipelineMetrics metrics) {
        return new ImagingStepRunner(executor, planner, transfer, commandRunner, metricsSource,
                aggregator, metrics, properties);
    }

    @Bean
    public JobCollectionStore jobCollectionStore(ObjectMapper objectMapper) {
        return new JobCollectionStore(Paths.get(properties.getJobs().getCollectionFile()), objectMapper);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PartitioningEngine partitioningEngine, StepRunner stepRunner,
                                                     ImagingStepRunner imagingStepRunner, JobCollectionStore jobStore) {
        return new PipelineOrchestrator(partitioningEngine, stepRunner, imagingStepRunner, jobStore);
    }
}
