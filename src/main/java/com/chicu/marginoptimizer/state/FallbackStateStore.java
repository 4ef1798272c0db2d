package com.chicu.marginoptimizer.state;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Local + remote.
 * <ul>
 *     <li>load: локальный файл, если он существует; remote только если локального нет
 *     (например, первый запуск на новой машине)</li>
 *     <li>save: сначала локально (ошибка фатальна), потом remote best-effort</li>
 * </ul>
 */
@Slf4j
public class FallbackStateStore implements StateStore {

    private final LocalFileStateStore local;
    private final StateStore remote;

    public FallbackStateStore(LocalFileStateStore local, StateStore remote) {
        this.local = local;
        this.remote = remote;
    }

    @Override
    public Optional<String> load() {
        if (local.exists()) {
            return local.load();
        }

        try {
            Optional<String> blob = remote.load();
            if (blob.isPresent()) {
                log.info("☁️ State restored from {}", remote.describe());
            }
            return blob;
        } catch (Exception e) {
            log.warn("⚠️ Failed to load state from {}: {}", remote.describe(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String blob) {
        local.save(blob);

        try {
            remote.save(blob);
        } catch (Exception e) {
            log.warn("⚠️ Failed to sync state to {}: {}", remote.describe(), e.getMessage());
        }
    }

    @Override
    public String describe() {
        return local.describe() + " (+" + remote.describe() + ")";
    }
}
