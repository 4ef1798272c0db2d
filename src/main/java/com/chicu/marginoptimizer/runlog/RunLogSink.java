package com.chicu.marginoptimizer.runlog;

public interface RunLogSink {

    /**
     * Никогда не бросает: ошибка записи аудита не должна влиять на решение.
     *
     * @return true, если запись сохранена (или сохранять некуда)
     */
    boolean record(RunLogEntry entry);
}
