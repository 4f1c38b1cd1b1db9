package com.botflow.botflow_backend.dispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReplyDispatchListener {

    private final ReplyDispatcher replyDispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onReply(OutboundReply reply) {
        try {
            replyDispatcher.dispatch(reply);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch reply for bot {} contact {}: {}",
                    reply.botId(), reply.contact(), e.getMessage(), e);
        }
    }
}
