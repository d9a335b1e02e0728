package com.controlplane.engine.execution;

import com.controlplane.core.exception.ControlPlaneException;
import com.controlplane.core.exception.InvalidStateTransitionException;
import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.model.StepStatus;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.model.TaskOutcome;
import com.controlplane.core.model.TaskStatus;
import com.controlplane.core.model.WorkflowDefinition;
import com.controlplane.core.repository.TaskRepository;
import com.controlplane.core.step.CancellationToken;
import com.controlplane.core.step.Step;
import com.controlplane.core.step.StepContext;
import com.controlplane.core.step.StepException;
import com.controlplane.engine.logging.LoggingContext;
import com.controlplane.engine.metrics.TaskMetrics;
import com.controlplane.engine.workflow.StepRegistry;
import com.controlplane.engine.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates tasks and executes their steps in workflow order.
 *
 * Each run executes on the task executor; each step invocation on the step executor,
 * so a cancelled run stops waiting on a step that ignores interruption.
 * Steps of one task never overlap. Runs of different tasks share no lock.
 */
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);

    public static final String INTERNAL_ERROR = "INTERNAL";
    public static final String ENGINE_UNAVAILABLE = "ENGINE_UNAVAILABLE";

    private final WorkflowRegistry workflowRegistry;
    private final StepRegistry stepRegistry;
    private final TaskRepository taskRepository;
    private final ExecutorService taskExecutor;
    private final ExecutorService stepExecutor;
    private final TaskMetrics metrics;
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public TaskEngine(
            WorkflowRegistry workflowRegistry,
            StepRegistry stepRegistry,
            TaskRepository taskRepository,
            ExecutorService taskExecutor,
            ExecutorService stepExecutor,
            TaskMetrics metrics) {
        this.workflowRegistry = workflowRegistry;
        this.stepRegistry = stepRegistry;
        this.taskRepository = taskRepository;
        this.taskExecutor = taskExecutor;
        this.stepExecutor = stepExecutor;
        this.metrics = metrics;
    }

    /**
     * Materialize a task for a workflow kind and persist it with every step pending.
     *
     * @throws NotFoundException if the kind, or one of its steps, is not registered
     */
    public Task create(String workflowKind) {
        WorkflowDefinition definition = requireDefinition(workflowKind);

        List<String> missing = stepRegistry.missing(definition.steps());
        if (!missing.isEmpty()) {
            throw new NotFoundException("Step", String.join(", ", missing));
        }

        Task task = Task.create(definition);
        taskRepository.save(task);

        log.info("Created task {} for workflow {} with {} steps", task.id(), workflowKind, definition.size());
        return task;
    }

    /**
     * Start executing a pending task. Returns as soon as the run is scheduled.
     *
     * @param task The task returned by {@link #create}
     * @param config Snapshot the steps run against; attached to the task record without credentials
     * @param logSink Destination of step output; closed when the run ends, or right away if it cannot start
     * @param cancellationToken Aborts the in-flight step and skips the rest when cancelled
     * @throws ValidationException if the config is unusable; nothing is started
     * @throws InvalidStateTransitionException if the task was already started
     */
    public TaskRun run(Task task, TaskConfig config, OutputStream logSink, CancellationToken cancellationToken) {
        try {
            validate(config);
            Task stored = getTask(task.id());
            if (stored.status() != TaskStatus.PENDING || !active.add(task.id())) {
                throw new InvalidStateTransitionException(stored.status(), TaskStatus.RUNNING);
            }
            WorkflowDefinition definition = requireDefinition(stored.workflowKind());

            Task configured = stored.withConfig(config);
            TaskRun run = new TaskRun(task.id());
            try {
                taskExecutor.execute(() -> execute(configured, definition, logSink, cancellationToken, run));
            } catch (RejectedExecutionException e) {
                active.remove(task.id());
                throw new ControlPlaneException(ENGINE_UNAVAILABLE, "Task engine is not accepting new runs", e);
            }
            return run;
        } catch (RuntimeException e) {
            // the sink is owned by the run; a run that never starts still closes it
            closeSink(task.id(), logSink);
            throw e;
        }
    }

    private void execute(Task task, WorkflowDefinition definition, OutputStream logSink,
                         CancellationToken token, TaskRun run) {
        Instant started = Instant.now();
        Task current = task;
        TaskOutcome outcome = null;

        try (LoggingContext ctx = LoggingContext.forTask(task.id(), task.workflowKind(),
                task.config().clusterName())) {
            try {
                metrics.taskStarted(task.workflowKind());
                current = save(current.withStatus(TaskStatus.RUNNING));
                log.info("Task {} started", task.id());

                for (int i = 0; i < definition.size() && outcome == null; i++) {
                    String stepName = definition.steps().get(i);

                    if (token.isCancelled()) {
                        String message = "cancelled: " + token.reason().orElse("unknown");
                        current = save(current.withStepFailed(i, message, Instant.now()));
                        outcome = TaskOutcome.failure(current, stepName, StepException.CANCELLED, message);
                        log.warn("Task {} cancelled before step {}", task.id(), stepName);
                        break;
                    }

                    current = save(current.withStepStarted(i, Instant.now()));
                    Instant stepStarted = Instant.now();

                    try (LoggingContext stepCtx = LoggingContext.forStep(stepName)) {
                        Step step = stepRegistry.find(stepName)
                            .orElseThrow(() -> new NotFoundException("Step", stepName));
                        StepContext context = new StepContext(task.id(), task.workflowKind(), stepName,
                            task.config(), logSink, token);

                        log.info("Running step {} ({}/{})", stepName, i + 1, definition.size());
                        invoke(step, context, token);

                        current = save(current.withStepSucceeded(i, Instant.now()));
                        metrics.stepFinished(task.workflowKind(), stepName, "success",
                            Duration.between(stepStarted, Instant.now()));
                    } catch (StepException e) {
                        current = save(current.withStepFailed(i, e.getMessage(), Instant.now()));
                        outcome = TaskOutcome.failure(current, stepName, e.getErrorCode(), e.getMessage());
                        metrics.stepFinished(task.workflowKind(), stepName, "failure",
                            Duration.between(stepStarted, Instant.now()));
                        log.warn("Step {} failed [{}]: {}", stepName, e.getErrorCode(), e.getMessage());
                    }
                }

                if (outcome == null) {
                    current = save(current.withStatus(TaskStatus.SUCCESS));
                    outcome = TaskOutcome.success(current);
                    log.info("Task {} succeeded", task.id());
                } else {
                    current = save(current.withStatus(TaskStatus.FAILURE));
                    log.warn("Task {} failed at step {}", task.id(), outcome.failedStep());
                }
            } catch (RuntimeException e) {
                log.error("Task {} aborted by internal error", task.id(), e);
                outcome = abort(current, e);
            } finally {
                closeSink(task.id(), logSink);
                if (outcome == null) {
                    outcome = TaskOutcome.failure(current, null, INTERNAL_ERROR, "run ended without an outcome");
                }
                active.remove(task.id());
                run.complete(outcome);
                metrics.taskFinished(task.workflowKind(), outcome.status().name(),
                    Duration.between(started, Instant.now()));
            }
        }
    }

    /**
     * Invoke a step and wait for it, or for cancellation, whichever comes first.
     */
    private void invoke(Step step, StepContext context, CancellationToken token) throws StepException {
        CompletableFuture<Void> result = new CompletableFuture<>();
        Future<?> execution = stepExecutor.submit(() -> {
            try {
                step.run(context);
                result.complete(null);
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });

        try (CancellationToken.Registration registration = token.onCancel(reason -> {
            result.completeExceptionally(StepException.cancelled(reason));
            execution.cancel(true);
        })) {
            result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StepException stepException) {
                throw stepException;
            }
            if (cause instanceof InterruptedException) {
                throw StepException.cancelled(token.reason().orElse("interrupted"));
            }
            throw new StepException(StepException.STEP_FAILED,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            execution.cancel(true);
            Thread.currentThread().interrupt();
            throw StepException.cancelled("engine shutting down");
        }
    }

    /**
     * Best effort to leave a terminal record behind after an internal error.
     */
    private TaskOutcome abort(Task current, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String errorCode = cause instanceof ControlPlaneException cpe ? cpe.getErrorCode() : INTERNAL_ERROR;

        String failedStep = null;
        Task failed = current;
        for (int i = 0; i < failed.stepStatuses().size(); i++) {
            StepStatus step = failed.step(i);
            if (!step.state().isTerminal()) {
                failedStep = step.stepName();
                failed = failed.withStepFailed(i, message, Instant.now());
                break;
            }
        }
        if (!failed.status().isTerminal()) {
            if (failed.status() == TaskStatus.PENDING) {
                failed = failed.withStatus(TaskStatus.RUNNING);
            }
            failed = failed.withStatus(TaskStatus.FAILURE);
        }

        try {
            taskRepository.save(failed);
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}; stored record may still show {}",
                current.id(), current.status(), e);
        }
        return TaskOutcome.failure(failed, failedStep, errorCode, message);
    }

    private Task save(Task task) {
        taskRepository.save(task);
        return task;
    }

    private WorkflowDefinition requireDefinition(String workflowKind) {
        return workflowRegistry.definition(workflowKind)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowKind));
    }

    private void validate(TaskConfig config) {
        if (config == null) {
            throw new ValidationException("config", "must not be null");
        }
        config.validate();
    }

    private void closeSink(String taskId, OutputStream logSink) {
        if (logSink == null) {
            return;
        }
        try {
            logSink.close();
        } catch (IOException e) {
            log.warn("Failed to close log sink of task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Number of runs started and not yet completed.
     */
    public int activeRuns() {
        return active.size();
    }

    /**
     * Task as currently stored.
     *
     * @throws NotFoundException if no such task exists
     */
    public Task getTask(String taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }
}
