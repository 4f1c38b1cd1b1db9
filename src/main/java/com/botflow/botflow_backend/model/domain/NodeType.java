package com.botflow.botflow_backend.model.domain;

/**
 * Node kinds the traversal engine treats specially. Nodes store their kind as a free-form
 * string so the editor can introduce new kinds without a schema change.
 */
public enum NodeType {
    START,
    MESSAGE,
    DECISION,
    END,
    MENU_OPTION;

    public String wireName() {
        return name().toLowerCase();
    }

    public boolean matches(String raw) {
        return raw != null && wireName().equalsIgnoreCase(raw.trim());
    }
}
