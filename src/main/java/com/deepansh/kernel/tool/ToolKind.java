package com.deepansh.kernel.tool;

public enum ToolKind {
    /** In-process Java implementation */
    BUILTIN,
    /** Untrusted module run by the sandbox executor */
    SANDBOX,
    /** Call into another agent; subject to the recursion depth cap */
    SUB_AGENT
}
