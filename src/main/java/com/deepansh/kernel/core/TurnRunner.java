package com.deepansh.kernel.core;

import com.deepansh.kernel.model.TurnResult;

/** "Run one turn for agent X with input Y" at a given agent call depth. */
public interface TurnRunner {

    TurnResult runTurn(String agentId, String input, int depth);
}
