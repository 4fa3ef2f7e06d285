package com.deepansh.kernel.guard;

public enum LoopGuardVerdict {
    /** Execute normally */
    ALLOW,
    /** Execute, but tell the model it is repeating itself */
    WARN,
    /** Refuse this call; the model gets an error result and can adapt */
    BLOCK,
    /** Terminate the whole turn */
    CIRCUIT_BREAK
}
