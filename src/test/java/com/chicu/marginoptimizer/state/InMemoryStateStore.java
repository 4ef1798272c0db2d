package com.chicu.marginoptimizer.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище для тестов: держит последний blob и историю сохранений.
 */
public class InMemoryStateStore implements StateStore {

    private String blob;
    private final List<String> saves = new ArrayList<>();

    public InMemoryStateStore() {
    }

    public InMemoryStateStore(String initial) {
        this.blob = initial;
    }

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(blob);
    }

    @Override
    public void save(String blob) {
        this.blob = blob;
        saves.add(blob);
    }

    @Override
    public String describe() {
        return "memory";
    }

    public String blob() {
        return blob;
    }

    public int saveCount() {
        return saves.size();
    }
}
