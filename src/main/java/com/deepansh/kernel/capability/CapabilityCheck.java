package com.deepansh.kernel.capability;

public record CapabilityCheck(boolean granted, String reason) {

    private static final CapabilityCheck GRANTED = new CapabilityCheck(true, null);

    public static CapabilityCheck grant() {
        return GRANTED;
    }

    public static CapabilityCheck deny(String reason) {
        return new CapabilityCheck(false, reason);
    }

    public void require() {
        if (!granted) {
            throw new CapabilityDeniedException(reason);
        }
    }
}
