package ru.nsu.fanout.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.BatchState;
import ru.nsu.fanout.model.DispatchResult;
import ru.nsu.fanout.model.TaskBatch;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Проводит пакет через все этапы: проверка живости, разбиение,
 * параллельная отправка и сборка результатов.
 */
@Slf4j
public class BatchCoordinator {
    private final WorkerRegistry registry;
    private final HealthProber healthProber;
    private final TaskPartitioner partitioner;
    private final SliceDispatcher dispatcher;
    private final Path outputRoot;
    private final ObjectMapper objectMapper;

    public BatchCoordinator(WorkerRegistry registry, HealthProber healthProber, TaskPartitioner partitioner,
                            SliceDispatcher dispatcher, Path outputRoot, ObjectMapper objectMapper) {
        this.registry = registry;
        this.healthProber = healthProber;
        this.partitioner = partitioner;
        this.dispatcher = dispatcher;
        this.outputRoot = outputRoot;
        this.objectMapper = objectMapper;
    }

    /**
     * Обрабатывает пакет. Отказы отдельных worker-ов и элементов не приводят к исключению:
     * они лишь уменьшают число сохранённых файлов в результате.
     *
     * @throws ValidationException         пакет без файлов
     * @throws NoWorkersAvailableException после проверки не осталось живых worker-ов
     */
    public DispatchResult submit(TaskBatch batch) {
        TaskType taskType = batch.getTaskType();
        if (batch.getFiles().isEmpty()) {
            throw new ValidationException("No files provided for " + taskType + " processing");
        }
        BatchContext context = new BatchContext(batch);

        healthProber.probe();
        List<WorkerEndpoint> endpoints = registry.snapshot();
        if (endpoints.isEmpty()) {
            context.transitionTo(BatchState.REJECTED);
            log.warn("Batch {} rejected: no workers available", context.getBatchId());
            throw new NoWorkersAvailableException("No workers available");
        }
        context.transitionTo(BatchState.PROBED);

        List<TaskSlice> slices = partitioner.partition(batch.getFiles(), endpoints);
        context.transitionTo(BatchState.PARTITIONED);
        log.info("Batch {}: {} files split into {} slices over {} workers",
                context.getBatchId(), batch.size(), slices.size(), endpoints.size());

        ResultAggregator aggregator = new ResultAggregator(taskType, createOutputDir(taskType), objectMapper);
        context.transitionTo(BatchState.DISPATCHING);
        dispatcher.dispatch(slices, taskType, aggregator::accept);
        context.transitionTo(BatchState.AGGREGATED);

        DispatchResult result = aggregator.result();
        log.info("Batch {} complete: {} of {} files saved, {} slices failed",
                context.getBatchId(), result.getTotalFilesProcessed(), batch.size(), aggregator.getFailedSlices());
        return result;
    }

    private Path createOutputDir(TaskType taskType) {
        Path outputDir = outputRoot.resolve(taskType.getWireName());
        try {
            return Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }
    }
}
