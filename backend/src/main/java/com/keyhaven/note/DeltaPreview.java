package com.keyhaven.note;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Plain-text preview of a rich-text body stored as a list of insert operations
 * ({@code [{"insert":"Hello "},{"insert":"world\n"}]}). Bodies that are not such a list are previewed as-is.
 */
public final class DeltaPreview {

    public static final int MAX_LENGTH = 500;

    private DeltaPreview() {
    }

    /** @return {@code null} for a null or empty body */
    public static String extract(String content, ObjectMapper objectMapper) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        JsonNode ops;
        try {
            ops = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return content;
        }
        if (ops == null || !ops.isArray()) {
            return content;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode op : ops) {
            JsonNode insert = op.get("insert");
            if (insert != null && insert.isTextual()) {
                text.append(insert.asText());
            }
        }
        String preview = text.toString().trim();
        return preview.length() > MAX_LENGTH ? preview.substring(0, MAX_LENGTH) + "..." : preview;
    }
}
