package com.taskloop.core.agent;

import com.taskloop.core.model.SelectedTask;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything needed to run the coding agent once.
 *
 * @param task        the task the agent works on
 * @param projectRoot working directory of the agent
 * @param prompt      full prompt text
 * @param timeout     hard limit on the agent's run time
 * @param iteration   iteration number the invocation belongs to
 */
public record AgentRequest(SelectedTask task, Path projectRoot, String prompt, Duration timeout, int iteration) {
}
