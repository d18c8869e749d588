package com.taskweave.core.model;

import com.taskweave.core.llm.ResponseParseException;

import java.util.Objects;
import java.util.function.Function;

/**
 * An independent, retryable unit of work: one instruction for the execution
 * capability plus the parser that turns the response text into a typed output.
 * <p>
 * Created by {@link Job#decompose()}, never mutated, consumed once by the orchestrator.
 *
 * @param <O> parsed output type
 */
public interface SubTask<O> {

    String id();

    String name();

    /** Instruction text sent to the execution capability. */
    String instruction();

    /**
     * Parses the capability's response. Must be free of side effects; it may be
     * called once per attempt.
     *
     * @throws ResponseParseException when the text is malformed
     */
    O parseResponse(String text);

    /**
     * Builds a sub-task from a parser function. Any runtime failure raised by the
     * parser surfaces as a {@link ResponseParseException}.
     */
    static <O> SubTask<O> of(String id, String name, String instruction, Function<String, O> parser) {
        return new FunctionalSubTask<>(id, name, instruction, parser);
    }

    record FunctionalSubTask<O>(String id, String name, String instruction, Function<String, O> parser)
            implements SubTask<O> {

        public FunctionalSubTask {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(instruction, "instruction");
            Objects.requireNonNull(parser, "parser");
            if (name == null || name.isBlank()) name = id;
        }

        @Override
        public O parseResponse(String text) {
            try {
                O output = parser.apply(text);
                if (output == null) {
                    throw new ResponseParseException("Parser for sub-task " + id + " returned no output");
                }
                return output;
            } catch (ResponseParseException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ResponseParseException("Failed to parse response for sub-task " + id
                        + ": " + e.getMessage(), e);
            }
        }

        @Override
        public String toString() {
            return "SubTask[" + id + " " + name + "]";
        }
    }
}
