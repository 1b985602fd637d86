package com.spreadsheet.engine.formula;

/**
 * Blocks the evaluating thread for SLEEP(n). Replaceable so tests can observe calls.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long seconds);
}
