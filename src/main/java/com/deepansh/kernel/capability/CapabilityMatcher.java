package com.deepansh.kernel.capability;

import java.util.Collection;

/**
 * The matching rule shared by runtime checks, sandbox host calls and spawn-time inheritance.
 *
 * Pattern values use {@code *} as a wildcard for any run of characters, anywhere in the
 * pattern: {@code *}, {@code *.openai.com:443}, {@code /data/*}, {@code api.*.com}.
 */
public final class CapabilityMatcher {

    private CapabilityMatcher() {
    }

    /** True when {@code granted} satisfies {@code required}. */
    public static boolean matches(Capability granted, Capability required) {
        if (granted.type() == CapabilityType.TOOL_ALL && required.type() == CapabilityType.TOOL_INVOKE) {
            return true;
        }
        if (granted.type() != required.type()) {
            return false;
        }
        return switch (granted.type().scope()) {
            case NONE -> true;
            case BOUND -> granted.bound() >= required.bound();
            case PATTERN -> globMatches(granted.value(), required.value());
        };
    }

    public static boolean matchesAny(Collection<Capability> granted, Capability required) {
        for (Capability g : granted) {
            if (matches(g, required)) return true;
        }
        return false;
    }

    /**
     * Fails with {@link PrivilegeEscalationException} on the first child capability
     * that no parent capability covers.
     */
    public static void validateInheritance(Collection<Capability> parent, Collection<Capability> child) {
        for (Capability requested : child) {
            if (!matchesAny(parent, requested)) {
                throw new PrivilegeEscalationException(
                        "Privilege escalation denied: child requests " + requested
                                + " but parent does not hold a matching grant");
            }
        }
    }

    public static boolean globMatches(String pattern, String value) {
        if (pattern == null || value == null) return false;
        if (pattern.equals("*") || pattern.equals(value)) return true;
        if (pattern.indexOf('*') < 0) return false;

        String[] parts = pattern.split("\\*", -1);
        String prefix = parts[0];
        String suffix = parts[parts.length - 1];

        if (value.length() < prefix.length() + suffix.length()) return false;
        if (!value.startsWith(prefix) || !value.endsWith(suffix)) return false;

        // Interior literals must appear in order between prefix and suffix
        int cursor = prefix.length();
        int limit = value.length() - suffix.length();
        for (int i = 1; i < parts.length - 1; i++) {
            String part = parts[i];
            if (part.isEmpty()) continue;
            int found = value.indexOf(part, cursor);
            if (found < 0 || found + part.length() > limit) return false;
            cursor = found + part.length();
        }
        return true;
    }
}
