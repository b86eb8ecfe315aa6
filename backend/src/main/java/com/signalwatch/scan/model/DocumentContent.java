package com.signalwatch.scan.model;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

public record DocumentContent(
    String documentId,
    String contentType,
    byte[] body
) {
    public boolean isPdf() {
        return hasType("pdf") || startsWith("%PDF");
    }

    public boolean isMarkup() {
        return hasType("html") || hasType("xml");
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    private boolean hasType(String fragment) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(fragment);
    }

    private boolean startsWith(String magic) {
        if (body == null || body.length < magic.length()) {
            return false;
        }
        return new String(body, 0, magic.length(), StandardCharsets.US_ASCII).equals(magic);
    }
}
