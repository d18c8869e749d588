package com.taskweave.jobs.digest;

/**
 * Input of a {@link DocumentDigestJob}.
 *
 * @param title  document title, used in instructions and the final digest
 * @param text   full document text
 */
public record DigestRequest(String title, String text) {

    public DigestRequest {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Document text must not be blank");
        }
        if (title == null || title.isBlank()) {
            title = "Untitled";
        }
    }
}
