package com.example.bucketbrowser.metadata;

public record Breadcrumb(
        String name,
        String prefix
) {
}
