package com.taskloop.core.agent;

/**
 * Runs the external coding agent against one task. Implementations must return rather
 * than throw for ordinary agent failures.
 */
public interface AgentInvoker {

    AgentResult invoke(AgentRequest request);
}
