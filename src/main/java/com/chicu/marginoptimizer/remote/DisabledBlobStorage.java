package com.chicu.marginoptimizer.remote;

import java.util.Optional;

/**
 * Хранилище не настроено: чтение ничего не находит, запись запрещена.
 */
final class DisabledBlobStorage implements BlobStorage {

    static final DisabledBlobStorage INSTANCE = new DisabledBlobStorage();

    private DisabledBlobStorage() {}

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, byte[] body, String contentType) {
        throw new IllegalStateException("Remote storage is not configured (margin.remote.base-url)");
    }

    @Override
    public String keyFor(String name) {
        return name;
    }
}
