package com.botflow.botflow_backend.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default channel: writes the reply to the log. A channel integration replaces it with a {@code @Primary} bean. */
@Slf4j
@Component
public class LoggingReplyDispatcher implements ReplyDispatcher {

    @Override
    public void dispatch(OutboundReply reply) {
        log.info("Reply for bot {} contact {} (node {}, {} options): {}",
                reply.botId(), reply.contact(), reply.nodeId(), reply.options().size(), reply.text());
    }
}
