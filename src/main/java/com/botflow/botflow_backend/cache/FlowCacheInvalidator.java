package com.botflow.botflow_backend.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Clears every cached view of a bot's graph once the write that changed it has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowCacheInvalidator {

    private final GraphCache graphCache;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onGraphChanged(FlowGraphChangedEvent event) {
        if (event == null || event.botId() == null) {
            return;
        }
        invalidate(event.botId());
        log.info("Flow cache invalidated for bot {} ({})", event.botId(), event.reason());
    }

    public void invalidate(Long botId) {
        graphCache.evictByPrefix(CacheKeys.botPrefix(CacheKeys.FLOW_NAMESPACE, botId));
    }
}
