package com.oracle.lats.core;

import com.oracle.lats.search.model.WinningPath;

/**
 * Append-only sink for winning paths. Implementations must not throw: a lost record
 * is logged, never reported to the search caller.
 */
public interface WinningPathStore {

    void record(WinningPath winningPath);
}
