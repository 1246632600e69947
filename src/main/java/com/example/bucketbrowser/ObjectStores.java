package com.example.bucketbrowser;

import com.example.bucketbrowser.store.ContentTypeDetector;
import com.example.bucketbrowser.store.LocalDirectoryObjectStore;
import com.example.bucketbrowser.store.ObjectStore;
import com.example.bucketbrowser.store.S3ObjectStore;
import org.apache.tika.Tika;

final class ObjectStores {
    private ObjectStores() {
    }

    static ObjectStore fromConfig(BrowserConfig config) {
        if (config.storeType() == BrowserConfig.StoreType.LOCAL) {
            return new LocalDirectoryObjectStore(
                    config.localRoot().orElseThrow(),
                    config.listPageSize(),
                    new ContentTypeDetector(new Tika())
            );
        }
        return new S3ObjectStore(
                config.bucket().orElseThrow(),
                config.region(),
                config.listPageSize(),
                config.storeCallTimeout()
        );
    }
}
