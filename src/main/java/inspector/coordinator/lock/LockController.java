package inspector.coordinator.lock;

import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.PushDeliveryException;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.Event;
import inspector.coordinator.event.EventKind;
import inspector.coordinator.event.Subscription;
import inspector.coordinator.event.TaskResultPayload;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.service.DispatchService;
import inspector.coordinator.util.KeyedDebouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Auto-resubmission policy owned by one observer.
 *
 * <p>While armed, every {@code task_result} for a locked task type schedules a fresh task for the
 * same station after the debounce delay. Completions for the same (type, station) inside the
 * window collapse into one requeue. Disarming cancels requeues that have not fired yet; the
 * locked set is kept for the next arm.
 *
 * <p>If the hub drops the controller's subscription (buffer overflow during a burst), an armed
 * controller subscribes again. Results published while it was detached are not requeued.
 */
public class LockController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LockController.class);

    record RequeueKey(TaskType taskType, int stationId) {
    }

    private final BroadcastHub hub;
    private final DispatchService dispatch;
    private final KeyedDebouncer<RequeueKey> debouncer;
    private final Set<TaskType> lockedTypes = ConcurrentHashMap.newKeySet();

    private volatile boolean enabled;
    private Subscription subscription;
    private int resubscriptions;

    public LockController(BroadcastHub hub, DispatchService dispatch, Duration debounce) {
        this.hub = hub;
        this.dispatch = dispatch;
        this.debouncer = new KeyedDebouncer<>(debounce, "lock-requeue");
    }

    /**
     * Enable with the given set of locked types.
     */
    public synchronized void arm(Collection<TaskType> pendingTypes) {
        lockedTypes.clear();
        if (pendingTypes != null) {
            lockedTypes.addAll(pendingTypes);
        }
        enabled = true;
        if (subscription == null || subscription.isClosed()) {
            subscription = listen();
        }
        log.info("Lock armed for types {}", lockedTypes);
    }

    private Subscription listen() {
        return hub.subscribe(this::onEvent, this::onDropped);
    }

    private synchronized void onDropped(PushDeliveryException reason) {
        if (!enabled || subscription == null || subscription.id() != reason.subscriptionId()) {
            return;
        }
        subscription = listen();
        resubscriptions++;
        log.warn("Lock subscription {} dropped ({}), resubscribed as {}",
                reason.subscriptionId(), reason.getMessage(), subscription.id());
    }

    /**
     * Enable with the types currently waiting in the queue.
     *
     * @return the seeded types
     */
    public OperationResult<Set<TaskType>> arm() {
        OperationResult<List<Task>> pending = dispatch.listPending(DispatchService.MAX_LIST_LIMIT);
        if (pending.isFailure()) {
            return OperationResult.failure(pending.error().orElseThrow(), pending.message());
        }
        Set<TaskType> types = new LinkedHashSet<>();
        for (Task task : pending.value()) {
            types.add(task.taskType());
        }
        arm(types);
        return OperationResult.success(types);
    }

    public synchronized void disarm() {
        enabled = false;
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        int cancelled = debouncer.cancelAll();
        log.info("Lock disarmed ({} pending requeues cancelled)", cancelled);
    }

    public void lock(TaskType taskType) {
        lockedTypes.add(taskType);
    }

    public void unlock(TaskType taskType) {
        lockedTypes.remove(taskType);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Set<TaskType> lockedTypes() {
        return lockedTypes.isEmpty() ? EnumSet.noneOf(TaskType.class) : EnumSet.copyOf(lockedTypes);
    }

    synchronized int resubscriptions() {
        return resubscriptions;
    }

    synchronized int backlog() {
        return subscription == null ? 0 : subscription.buffered();
    }

    void onEvent(Event event) {
        if (!enabled || event.kind() != EventKind.TASK_RESULT
                || !(event.payload() instanceof TaskResultPayload result)) {
            return;
        }
        TaskType type = TaskType.fromCode(result.taskType());
        if (!lockedTypes.contains(type)) {
            return;
        }
        RequeueKey key = new RequeueKey(type, result.stationId());
        debouncer.submit(key, () -> requeue(key));
    }

    private void requeue(RequeueKey key) {
        if (!enabled || !lockedTypes.contains(key.taskType())) {
            return;
        }
        OperationResult<String> added = dispatch.enqueue(key.stationId(), key.taskType().code(), Map.of());
        if (added.isSuccess()) {
            log.info("Requeued type {} for station {} as {}", key.taskType().code(), key.stationId(), added.value());
        } else {
            log.warn("Requeue of type {} for station {} failed: {}",
                    key.taskType().code(), key.stationId(), added.message());
        }
    }

    @Override
    public void close() {
        disarm();
        debouncer.close();
    }
}
