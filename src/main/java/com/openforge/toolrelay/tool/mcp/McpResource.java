package com.openforge.toolrelay.tool.mcp;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * One item of a resources/read result.  Text resources carry {@code text},
 * binary ones a base64 {@code blob}.
 */
public record McpResource(
        String uri,
        String mimeType,
        String text,
        String blob
) {

    /** The raw bytes: UTF-8 of the text, or the decoded blob. */
    public byte[] bytes() {
        if (blob != null) {
            return Base64.getDecoder().decode(blob);
        }
        return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }
}
