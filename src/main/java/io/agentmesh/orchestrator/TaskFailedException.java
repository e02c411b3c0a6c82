package io.agentmesh.orchestrator;

import io.agentmesh.model.TaskView;

/**
 * Raised to a submitter when a task ends FAILED. The cause is the last
 * concrete error seen while dispatching it.
 */
public final class TaskFailedException extends RuntimeException {
    private final TaskView task;

    public TaskFailedException(TaskView task, Throwable cause) {
        super("Task " + task.taskId() + " failed after " + task.attempts() + " attempt(s): " + task.lastError(), cause);
        this.task = task;
    }

    public TaskView task() {
        return task;
    }
}
