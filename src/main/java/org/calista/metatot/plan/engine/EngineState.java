package org.calista.metatot.plan.engine;

/**
 * Idle → Expanding → Selecting → BackingUp → (repeat) → Finalizing → Done.
 */
public enum EngineState {
    IDLE,
    EXPANDING,
    SELECTING,
    BACKING_UP,
    FINALIZING,
    DONE
}
