package com.taskweave.core.llm;

import com.taskweave.core.model.CancellationToken;

/**
 * Single-shot call that turns an instruction into response text.
 * <p>
 * Implementations make exactly one attempt per call. All retry policy lives in the
 * engine. A call already in flight is never interrupted by the engine.
 */
@FunctionalInterface
public interface ExecutionCapability {

    /**
     * @param instruction text to execute
     * @param profile     opaque selector for how the instruction is processed
     * @param token       cancellation signal of the owning job
     * @return the response text
     * @throws ExecutionFailedException when the call fails or produces nothing usable
     */
    String execute(String instruction, String profile, CancellationToken token);
}
