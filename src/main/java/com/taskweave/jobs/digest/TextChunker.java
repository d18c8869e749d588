package com.taskweave.jobs.digest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into chunks of at most {@code maxChars} characters, preferring
 * paragraph boundaries, then line boundaries, and cutting mid-line only when a
 * single line is longer than the limit.
 */
public class TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final int maxChars;

    public TextChunker(int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1, was " + maxChars);
        }
        this.maxChars = maxChars;
    }

    public List<String> split(String text) {
        String normalized = text == null ? "" : text.strip();
        if (normalized.isEmpty()) {
            return List.of();
        }
        if (normalized.length() <= maxChars) {
            return List.of(normalized);
        }

        var chunks = new ArrayList<String>();
        var current = new StringBuilder();
        for (String paragraph : PARAGRAPH_BREAK.split(normalized)) {
            for (String piece : fitParagraph(paragraph.strip())) {
                if (current.length() > 0
                        && current.length() + PARAGRAPH_SEPARATOR.length() + piece.length() > maxChars) {
                    chunks.add(current.toString());
                    current.setLength(0);
                }
                if (current.length() > 0) {
                    current.append(PARAGRAPH_SEPARATOR);
                }
                current.append(piece);
            }
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    private List<String> fitParagraph(String paragraph) {
        if (paragraph.isEmpty()) {
            return List.of();
        }
        if (paragraph.length() <= maxChars) {
            return List.of(paragraph);
        }
        var pieces = new ArrayList<String>();
        var current = new StringBuilder();
        for (String line : paragraph.split("\\n")) {
            for (String part : hardSplit(line.strip())) {
                if (current.length() > 0 && current.length() + 1 + part.length() > maxChars) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(part);
            }
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    private List<String> hardSplit(String line) {
        if (line.isEmpty()) {
            return List.of();
        }
        var parts = new ArrayList<String>();
        for (int start = 0; start < line.length(); start += maxChars) {
            parts.add(line.substring(start, Math.min(line.length(), start + maxChars)));
        }
        return parts;
    }
}
