package ru.nsu.fanout.coordinator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.BatchState;
import ru.nsu.fanout.model.TaskBatch;
import ru.nsu.fanout.model.TaskType;

import java.util.UUID;

@Slf4j
@Getter
public class BatchContext {
    private final UUID batchId;
    private final TaskType taskType;
    private final int fileCount;
    private BatchState state;

    public BatchContext(TaskBatch batch) {
        this.batchId = UUID.randomUUID();
        this.taskType = batch.getTaskType();
        this.fileCount = batch.size();
        this.state = BatchState.RECEIVED;
        log.info("Batch {} received: {} {} files", batchId, fileCount, taskType);
    }

    public void transitionTo(BatchState next) {
        if (!state.successors().contains(next)) {
            throw new IllegalStateException("Batch " + batchId + " cannot move from " + state + " to " + next);
        }
        log.debug("Batch {}: {} -> {}", batchId, state, next);
        state = next;
    }
}
