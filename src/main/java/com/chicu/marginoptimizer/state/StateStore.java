package com.chicu.marginoptimizer.state;

import java.util.Optional;

/**
 * Хранилище блоба состояния оптимизатора. Формат блоба знает только {@link StateCodec}.
 */
public interface StateStore {

    /**
     * @return блоб, если он есть
     */
    Optional<String> load();

    void save(String blob);

    /**
     * Для логов: где лежит состояние.
     */
    String describe();
}
