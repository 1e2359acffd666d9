package com.commutematch.matching;

import com.commutematch.matching.model.MatchResult;

/**
 * Receives finished match results. Must tolerate the same trip's result being delivered twice.
 */
public interface MatchResultSink {

    void accept(MatchResult result);
}
