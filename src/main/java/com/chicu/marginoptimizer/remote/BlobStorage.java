package com.chicu.marginoptimizer.remote;

import java.util.Optional;

/**
 * Удалённое key/value хранилище блобов (state, run logs, отчёты).
 * Ошибки транспорта -> IllegalStateException; вызывающий сам решает, фатально ли это.
 */
public interface BlobStorage {

    boolean enabled();

    /**
     * @return пусто, если ключа нет
     */
    Optional<byte[]> get(String key);

    void put(String key, byte[] body, String contentType);

    /**
     * prefix + "/" + name (лишние слэши в prefix срезаются).
     */
    String keyFor(String name);

    static BlobStorage disabled() {
        return DisabledBlobStorage.INSTANCE;
    }
}
