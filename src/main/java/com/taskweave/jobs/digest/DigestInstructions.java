package com.taskweave.jobs.digest;

/**
 * Builds the instruction text for digest calls.
 */
public final class DigestInstructions {

    private static final String RESPONSE_FORMAT = """
            Respond with a single JSON object and nothing else, in this shape:
            {"summary": "<two to four sentences>", "keyPoints": ["<point>", "<point>"]}
            Use at most 8 key points. Each key point is one short sentence.""";

    private DigestInstructions() {}

    public static String forChunk(String title, int chunkNumber, int chunkCount, String chunkText) {
        return """
                You are summarizing part %d of %d of the document "%s".
                Summarize only the excerpt below. Do not speculate about the other parts.

                %s

                ## Excerpt

                %s
                """.formatted(chunkNumber, chunkCount, title, RESPONSE_FORMAT, chunkText);
    }

    public static String forWholeDocument(String title, String text) {
        return """
                You are summarizing the document "%s".

                %s

                ## Document

                %s
                """.formatted(title, RESPONSE_FORMAT, text);
    }
}
