package com.raditha.neardup.matcher;

/**
 * States of one (query, document) scan.
 * SCANNING and VERIFYING alternate; MATCHED and EXHAUSTED are terminal.
 */
public enum MatchState {
    SCANNING,
    VERIFYING,
    MATCHED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == MATCHED || this == EXHAUSTED;
    }
}
