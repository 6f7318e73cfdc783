package com.logvault.query;

/**
 * Lifecycle of one submitted query. Transitions only move forward;
 * DONE and FAILED are terminal.
 */
public enum QueryState {
    INIT,
    SUBMITTED,
    POLLING,
    COMPLETE,
    PAGINATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canAdvanceTo(QueryState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return switch (this) {
            case INIT -> next == SUBMITTED;
            case SUBMITTED -> next == POLLING || next == COMPLETE;
            case POLLING -> next == POLLING || next == COMPLETE;
            case COMPLETE -> next == PAGINATING || next == DONE;
            case PAGINATING -> next == PAGINATING || next == DONE;
            default -> false;
        };
    }
}
