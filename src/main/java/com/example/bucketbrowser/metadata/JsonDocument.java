package com.example.bucketbrowser.metadata;

/**
 * A JSON object prepared for inline display.
 */
public record JsonDocument(
        ObjectMeta meta,
        String fileName,
        String parentPrefix,
        String content,
        boolean formatted
) {
}
