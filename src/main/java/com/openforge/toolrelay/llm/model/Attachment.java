package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A file or image attached to a message, a stage, or a streamed delta.
 *
 * Either {@code url} or inline {@code data} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(
        String type,
        String title,
        String data,
        String url,
        String referenceUrl,
        String referenceType
) {

    public static Attachment ofUrl(String type, String title, String url) {
        return new Attachment(type, title, null, url, null, null);
    }

    @JsonIgnore
    public boolean isImage() {
        return "image/png".equals(type) || "image/jpeg".equals(type);
    }
}
