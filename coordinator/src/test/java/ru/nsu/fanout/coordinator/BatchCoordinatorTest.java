package ru.nsu.fanout.coordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.model.DispatchResult;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.SliceResult;
import ru.nsu.fanout.model.TaskBatch;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorTest {
    private static final WorkerEndpoint A = new WorkerEndpoint("a", 3001);
    private static final WorkerEndpoint B = new WorkerEndpoint("b", 3001);

    @Mock
    private WorkerClient workerClient;

    @TempDir
    Path outputRoot;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final WorkerRegistry registry = new WorkerRegistry();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emptyRegistryIsRejectedBeforePartitioningOrDispatch() {
        TaskPartitioner partitioner = mock(TaskPartitioner.class);
        SliceDispatcher dispatcher = mock(SliceDispatcher.class);
        BatchCoordinator coordinator = new BatchCoordinator(registry,
                new HealthProber(registry, workerClient, executor), partitioner, dispatcher,
                outputRoot, JacksonConfig.createObjectMapper());

        assertThatThrownBy(() -> coordinator.submit(batch(TaskType.IMAGE, 2)))
                .isInstanceOf(NoWorkersAvailableException.class)
                .hasMessageContaining("No workers available");
        verifyNoInteractions(partitioner, dispatcher);
    }

    @Test
    void workersThatFailProbeAreNotUsed() {
        registry.register(A);
        when(workerClient.checkStatus(A)).thenReturn(false);

        assertThatThrownBy(() -> coordinator().submit(batch(TaskType.IMAGE, 1)))
                .isInstanceOf(NoWorkersAvailableException.class);
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void batchWithoutFilesIsInvalid() {
        HealthProber prober = mock(HealthProber.class);
        BatchCoordinator coordinator = new BatchCoordinator(registry, prober, new TaskPartitioner(),
                new SliceDispatcher(workerClient, registry, executor), outputRoot, JacksonConfig.createObjectMapper());

        assertThatThrownBy(() -> coordinator.submit(new TaskBatch(TaskType.TEXT, List.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No files provided for text processing");
        verifyNoInteractions(prober);
    }

    @Test
    void partialFailureReportsOnlySurvivingSlice() {
        registry.register(A);
        registry.register(B);
        when(workerClient.checkStatus(any())).thenReturn(true);
        when(workerClient.process(any(TaskSlice.class), any(TaskType.class))).thenAnswer(invocation -> {
            TaskSlice slice = invocation.getArgument(0);
            if (slice.getEndpoint().equals(B)) {
                return SliceResult.transportFailure(B, slice.size(), "connection refused");
            }
            List<ProcessedItem> items = new ArrayList<>();
            for (FileBlob file : slice.getFiles()) {
                items.add(new ProcessedItem(file.getFilename(), Base64.getEncoder().encodeToString(file.getContent())));
            }
            return SliceResult.success(A, slice.size(), items);
        });

        DispatchResult result = coordinator().submit(batch(TaskType.IMAGE, 5));

        assertThat(result.getTotalFilesProcessed()).isEqualTo(3);
        assertThat(result.getSavedFiles()).containsExactlyInAnyOrder(
                outputRoot.resolve("image").resolve("processed_file0.png").toString(),
                outputRoot.resolve("image").resolve("processed_file1.png").toString(),
                outputRoot.resolve("image").resolve("processed_file2.png").toString());
        assertThat(result.getMessage()).isEqualTo("Image processing complete");
        assertThat(registry.snapshot()).containsExactly(A);
    }

    @Test
    void slicesAreSentToProbedSnapshotInOrder() {
        registry.register(B);
        registry.register(A);
        when(workerClient.checkStatus(any())).thenReturn(true);
        SliceDispatcher dispatcher = mock(SliceDispatcher.class);
        BatchCoordinator coordinator = new BatchCoordinator(registry,
                new HealthProber(registry, workerClient, executor), new TaskPartitioner(), dispatcher,
                outputRoot, JacksonConfig.createObjectMapper());

        DispatchResult result = coordinator.submit(batch(TaskType.DOCUMENT, 3));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TaskSlice>> captor = ArgumentCaptor.forClass(List.class);
        verify(dispatcher).dispatch(captor.capture(), eq(TaskType.DOCUMENT), any());
        assertThat(captor.getValue()).extracting(TaskSlice::getEndpoint).containsExactly(A, B);
        assertThat(captor.getValue()).extracting(TaskSlice::size).containsExactly(2, 1);
        assertThat(result.getTotalFilesProcessed()).isZero();
        assertThat(outputRoot.resolve("document")).isDirectory();
    }

    private BatchCoordinator coordinator() {
        return new BatchCoordinator(registry,
                new HealthProber(registry, workerClient, executor),
                new TaskPartitioner(),
                new SliceDispatcher(workerClient, registry, executor),
                outputRoot,
                JacksonConfig.createObjectMapper());
    }

    private static TaskBatch batch(TaskType taskType, int count) {
        List<FileBlob> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(new FileBlob("file" + i + ".png", ("content-" + i).getBytes(), "image/png"));
        }
        return new TaskBatch(taskType, files);
    }
}
