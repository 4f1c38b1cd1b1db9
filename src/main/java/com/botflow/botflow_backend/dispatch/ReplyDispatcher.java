package com.botflow.botflow_backend.dispatch;

/**
 * Hands a reply to the messaging channel the contact came from. Called after the chat step has
 * committed; a failure here is logged and does not affect the stored conversation state.
 */
public interface ReplyDispatcher {

    void dispatch(OutboundReply reply);
}
