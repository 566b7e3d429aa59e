package com.linlay.agentengine.trace;

/**
 * A turn is provisional while tool executions are logged ahead of its final content, and
 * finalized once the loop appends it. Finalized turns never go back.
 */
public enum TurnState {
    PROVISIONAL,
    FINALIZED
}
