package com.deepansh.kernel.sandbox;

public enum SandboxErrorKind {
    /** Source failed to parse */
    COMPILATION,
    /** Top-level module code threw while defining its functions */
    INSTANTIATION,
    /** execute(input) threw */
    EXECUTION,
    /** Statement budget used up */
    FUEL_EXHAUSTED,
    /** Wall-clock budget elapsed, even if the module was blocked in a host call */
    TIMEOUT,
    /** Module broke the calling convention: no execute function, or a non-JSON result */
    ABI_ERROR,
    /** Module manifest requires capabilities the caller does not hold */
    CAPABILITY_DENIED,
    /** Memory ceiling crossed */
    MEMORY_EXCEEDED
}
