package com.chicu.marginoptimizer.state;

import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.remote.BlobStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Явный выбор варианта хранилища: local-only или local + remote fallback.
 * Ключ в remote = prefix + имя локального файла (у CSV-прогонов свой ключ).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateStoreFactory {

    private final OptimizerProperties props;
    private final BlobStorage blobStorage;

    public StateStore create(String statePath) {
        LocalFileStateStore local = new LocalFileStateStore(Path.of(statePath));

        if (!props.isRemoteStoreEnabled()) {
            return local;
        }

        if (!blobStorage.enabled()) {
            log.warn("⚠️ margin.optimizer.remote-store-enabled=true, но margin.remote.base-url пуст, работаю только локально");
            return local;
        }

        String key = blobStorage.keyFor(local.path().getFileName().toString());
        return new FallbackStateStore(local, new RemoteStateStore(blobStorage, key));
    }
}
