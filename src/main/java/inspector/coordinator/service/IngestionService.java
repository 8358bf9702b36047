package inspector.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.PersistenceException;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.event.AlertPayload;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.EventKind;
import inspector.coordinator.event.QueueUpdatePayload;
import inspector.coordinator.event.QueueUpdateReason;
import inspector.coordinator.event.TaskResultPayload;
import inspector.coordinator.model.FinishResult;
import inspector.coordinator.model.StoredResult;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskStatus;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.model.result.ResultPayload;
import inspector.coordinator.model.result.ResultPayloads;
import inspector.coordinator.repository.TaskQueueRepository;
import inspector.coordinator.repository.TaskRecordRepository;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Accepts results from the vision service.
 *
 * <p>Flow for one result:
 * <ol>
 * <li>classify with the {@link AlertEvaluator}</li>
 * <li>store the record and its alert in one transaction</li>
 * <li>move the queue entry to COMPLETED, or FAILED for a processing failure</li>
 * <li>publish {@code task_result}, then {@code alert}, then {@code task_queue_update}</li>
 * </ol>
 * If storing fails nothing is committed, the queue entry is left alone and nothing is published.
 */
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final TaskRecordRepository records;
    private final TaskQueueRepository queue;
    private final AlertEvaluator evaluator;
    private final BroadcastHub hub;

    public IngestionService(TaskRecordRepository records, TaskQueueRepository queue,
            AlertEvaluator evaluator, BroadcastHub hub) {
        this.records = records;
        this.queue = queue;
        this.evaluator = evaluator;
        this.hub = hub;
    }

    /**
     * Ingest a raw result as reported on the wire.
     *
     * @return id of the stored record
     */
    public OperationResult<Long> ingest(String taskId, Integer taskType, Integer stationId, JsonNode result,
            String imageRef, Double processingTime) {
        return OperationResult.of(() -> {
            TaskType type = TaskType.fromCode(taskType);
            ResultPayload payload = ResultPayloads.fromWire(type, result);
            return store(taskId, type, stationId, payload, imageRef, processingTime);
        });
    }

    /**
     * Ingest an already-parsed result.
     *
     * @return id of the stored record
     */
    public OperationResult<Long> ingestPayload(String taskId, TaskType taskType, Integer stationId, ResultPayload payload,
            String imageRef, Double processingTime) {
        return OperationResult.of(() -> store(taskId, taskType, stationId, payload, imageRef, processingTime));
    }

    private long store(String taskId, TaskType taskType, Integer stationId, ResultPayload payload,
            String imageRef, Double processingTime) {
        validate(taskId, taskType, stationId, payload, imageRef, processingTime);

        AlertEvaluator.Evaluation evaluation = evaluator.evaluate(taskType, stationId, payload);
        TaskRecord draft = TaskRecord.draft(taskId, taskType, stationId, imageRef, payload,
                evaluation.severity(), processingTime, Timestamps.now());

        StoredResult stored = records.append(draft, evaluation.alert());

        TaskStatus terminal = payload.isFailure() ? TaskStatus.FAILED : TaskStatus.COMPLETED;
        FinishResult finish;
        try {
            finish = queue.finish(taskId, terminal, stored.record().timestamp());
        } catch (PersistenceException e) {
            // Record is committed; the ingest still succeeds.
            log.error("Record {} stored but queue entry {} could not be finished",
                    stored.record().id(), taskId, e);
            finish = null;
        }
        if (finish != FinishResult.FINISHED) {
            log.debug("Queue entry {} not transitioned: {}", taskId, finish);
        }

        hub.publish(EventKind.TASK_RESULT, TaskResultPayload.from(stored.record()));
        if (stored.hasAlert()) {
            log.warn("Alert {} raised for task {}: {}", stored.alert().id(), taskId, stored.alert().message());
            hub.publish(EventKind.ALERT, AlertPayload.from(stored.alert()));
        }
        if (finish == FinishResult.FINISHED) {
            QueueUpdateReason reason = terminal == TaskStatus.FAILED
                    ? QueueUpdateReason.FAILED
                    : QueueUpdateReason.COMPLETED;
            hub.publish(EventKind.TASK_QUEUE_UPDATE, QueueUpdatePayload.of(reason, taskId));
        }

        log.info("Result for task {} ingested as record {} ({})",
                taskId, stored.record().id(), evaluation.severity().wireName());
        return stored.record().id();
    }

    private static void validate(String taskId, TaskType taskType, Integer stationId, ResultPayload payload,
            String imageRef, Double processingTime) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("task_id is required");
        }
        if (taskId.length() > Task.MAX_ID_LENGTH) {
            throw new ValidationException("task_id must be at most " + Task.MAX_ID_LENGTH + " characters");
        }
        if (imageRef != null && imageRef.length() > TaskRecord.MAX_IMAGE_REF_LENGTH) {
            throw new ValidationException("image_ref must be at most " + TaskRecord.MAX_IMAGE_REF_LENGTH + " characters");
        }
        if (taskType == null) {
            throw new ValidationException("task_type is required");
        }
        if (stationId == null || stationId < 1) {
            throw new ValidationException("station_id must be a positive integer");
        }
        if (payload == null) {
            throw new ValidationException("result is required");
        }
        if (processingTime != null && (processingTime < 0 || processingTime.isNaN())) {
            throw new ValidationException("processing_time must not be negative");
        }
    }
}
