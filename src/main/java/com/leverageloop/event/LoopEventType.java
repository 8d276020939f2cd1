package com.leverageloop.event;

public enum LoopEventType {
    LOOP_OPENED,
    ITERATION_COMPLETED,
    LOOP_FINALIZED,
    LOOP_UNWOUND,
    UNWIND_FAILED,
    LOOP_RECOVERED
}
