package com.chicu.marginoptimizer.optimizer;

public enum DecisionType {
    /** первое окно: фиксируем baseline и делаем первый шаг вверх */
    COLD_START,
    /** guardrail не прошёл: откат на last safe, шаг / 2 */
    ROLLBACK,
    /** profit вырос достаточно: новый baseline, шаг вверх */
    ACCEPT,
    /** guardrail ок, но прироста мало: откат на last safe, шаг / 2 */
    HOLD
}
