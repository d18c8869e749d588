package com.taskweave.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient Jackson parsing of JSON embedded in model responses.
 * <p>
 * Strips markdown code fences and any prose around the outermost JSON object
 * before deserializing. Unknown properties are ignored.
 */
public class JsonResponseParser {

    private static final Logger log = LoggerFactory.getLogger(JsonResponseParser.class);

    private final ObjectMapper mapper;

    public JsonResponseParser() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.registerModule(new ParameterNamesModule());
    }

    /**
     * @throws ResponseParseException if the text is blank or is not valid JSON for {@code type}
     */
    public <T> T parse(String text, Class<T> type) {
        if (text == null || text.isBlank()) {
            throw new ResponseParseException("Empty response, expected " + type.getSimpleName());
        }
        String cleaned = extractJson(text);
        try {
            T result = mapper.readValue(cleaned, type);
            if (result == null) {
                throw new ResponseParseException("Response decoded to null for " + type.getSimpleName());
            }
            return result;
        } catch (ResponseParseException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Unparseable response ({} chars): {}", cleaned.length(), cleaned);
            throw new ResponseParseException("Failed to parse response to " + type.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String extractJson(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start > 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        } else if (start == 0 && end > 0 && end < cleaned.length() - 1) {
            cleaned = cleaned.substring(0, end + 1);
        }
        return cleaned;
    }
}
