package com.leverageloop.recovery;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Captures the outcome of restoring active leverage loops from the store at startup.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    private int loopsRecovered;
    private int positionsRecovered;

    /** Loops already present in the active map, left untouched. */
    private int loopsSkipped;

    @Builder.Default
    private List<String> recoveredLoopIds = new ArrayList<>();
}
