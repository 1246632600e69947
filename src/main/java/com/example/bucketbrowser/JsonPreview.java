package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.JsonDocument;
import com.example.bucketbrowser.metadata.ObjectMeta;
import com.example.bucketbrowser.store.ObjectStore;
import com.example.bucketbrowser.store.ObjectStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Fetches a JSON object and pretty-prints it. Content that does not parse is returned as-is.
 */
public final class JsonPreview {
    private final ObjectStore store;
    private final ObjectMapper mapper;

    public JsonPreview(ObjectStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public JsonDocument render(ObjectMeta meta) {
        String raw;
        try (InputStream in = store.openObject(meta.key())) {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to read " + meta.key(), ex);
        }

        String parent = Prefixes.parentOf(meta.key());
        try {
            JsonNode tree = mapper.readTree(raw);
            String pretty = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
            return new JsonDocument(meta, meta.name(), parent, pretty, true);
        } catch (JsonProcessingException ex) {
            return new JsonDocument(meta, meta.name(), parent, raw, false);
        }
    }
}
