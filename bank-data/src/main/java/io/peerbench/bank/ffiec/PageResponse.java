package io.peerbench.bank.ffiec;

import java.nio.charset.StandardCharsets;

/** Status, content type and raw body of one form round trip. */
public record PageResponse(int status, String contentType, byte[] body) {
    public PageResponse {
        contentType = contentType == null ? "" : contentType;
        body = body == null ? new byte[0] : body;
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
