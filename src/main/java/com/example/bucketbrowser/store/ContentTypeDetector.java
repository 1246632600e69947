package com.example.bucketbrowser.store;

import com.example.bucketbrowser.metadata.ObjectMeta;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Detects content types for objects whose store does not record one.
 */
public class ContentTypeDetector {
    static final String DEFAULT_TYPE = "application/octet-stream";

    private final Tika tika;

    public ContentTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? DEFAULT_TYPE : mediaType.toString();
        } catch (IOException ex) {
            return detect(path.getFileName().toString());
        }
    }

    /**
     * Name-only detection, used when the content is not at hand.
     */
    public String detect(String name) {
        MediaType mediaType = MediaType.parse(tika.detect(name));
        return mediaType == null ? DEFAULT_TYPE : mediaType.toString();
    }

    /**
     * True when the object is JSON, judged by its recorded content type or, failing that, its extension.
     */
    public static boolean isJson(ObjectMeta meta) {
        if (meta.contentType() != null) {
            MediaType mediaType = MediaType.parse(meta.contentType());
            if (mediaType != null) {
                String subtype = mediaType.getSubtype().toLowerCase(Locale.ROOT);
                if (subtype.equals("json") || subtype.endsWith("+json")) {
                    return true;
                }
            }
        }
        return meta.key().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
