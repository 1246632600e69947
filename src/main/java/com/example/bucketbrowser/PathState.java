package com.example.bucketbrowser;

/**
 * What a request path denotes in the store.
 */
public enum PathState {
    IS_FILE,
    IS_DIR,
    /** A directory addressed without its trailing delimiter; canonical form adds the delimiter. */
    IS_DIR_NO_SLASH,
    NOT_FOUND
}
