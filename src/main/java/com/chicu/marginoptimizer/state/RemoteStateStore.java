package com.chicu.marginoptimizer.state;

import com.chicu.marginoptimizer.remote.BlobStorage;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Состояние в удалённом blob storage под одним ключом.
 * Ошибки транспорта пробрасываются как есть (IllegalStateException).
 */
public class RemoteStateStore implements StateStore {

    private final BlobStorage storage;
    private final String key;

    public RemoteStateStore(BlobStorage storage, String key) {
        this.storage = storage;
        this.key = key;
    }

    @Override
    public Optional<String> load() {
        return storage.get(key).map(b -> new String(b, StandardCharsets.UTF_8));
    }

    @Override
    public void save(String blob) {
        storage.put(key, blob.getBytes(StandardCharsets.UTF_8), "application/json");
    }

    @Override
    public String describe() {
        return "remote:" + key;
    }
}
