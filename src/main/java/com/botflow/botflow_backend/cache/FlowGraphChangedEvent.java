package com.botflow.botflow_backend.cache;

/** Published inside a graph write; handled once that write has committed. */
public record FlowGraphChangedEvent(Long botId, String reason) {}
