package com.chicu.marginoptimizer.runlog;

import lombok.extern.slf4j.Slf4j;

/**
 * Заглушка: remote storage не настроен, аудит только в лог.
 */
@Slf4j
public class NoopRunLogSink implements RunLogSink {

    @Override
    public boolean record(RunLogEntry entry) {
        if (log.isDebugEnabled()) {
            log.debug("📝 run log (not persisted): {} -> {} decision={} success={}",
                    entry.currentMargin(), entry.nextMargin(), entry.decision(), entry.success());
        }
        return true;
    }
}
