package com.deepansh.kernel.capability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every agent's capability set.
 *
 * Grants are stored as immutable lists and replaced wholesale, so {@link #check}
 * is a single lock-free map read. Writes only happen at spawn and kill.
 */
@Component
@Slf4j
public class CapabilityManager {

    private final Map<String, List<Capability>> grants = new ConcurrentHashMap<>();

    public void grant(String agentId, Collection<Capability> capabilities) {
        grants.put(agentId, List.copyOf(capabilities));
        log.info("Granted {} capabilities [agent={}]", capabilities.size(), agentId);
    }

    /**
     * Grants {@code capabilities} to a child only if the parent's set covers every one of them.
     * Nothing is written when validation fails. A parent's output-token bound always carries
     * down: a child that asks for no LlmMaxTokens gets the parent's.
     *
     * @return the set actually granted
     */
    public List<Capability> grantInherited(String parentId, String childId, Collection<Capability> capabilities) {
        try {
            CapabilityMatcher.validateInheritance(list(parentId), capabilities);
        } catch (PrivilegeEscalationException e) {
            log.warn("Spawn rejected [parent={}, child={}]: {}", parentId, childId, e.getMessage());
            throw e;
        }
        List<Capability> effective = new ArrayList<>(capabilities);
        OptionalLong parentBound = maxTokenBound(parentId);
        boolean childBounded = effective.stream().anyMatch(c -> c.type() == CapabilityType.LLM_MAX_TOKENS);
        if (parentBound.isPresent() && !childBounded) {
            effective.add(Capability.llmMaxTokens(parentBound.getAsLong()));
        }
        grant(childId, effective);
        return List.copyOf(effective);
    }

    public CapabilityCheck check(String agentId, Capability required) {
        List<Capability> held = grants.get(agentId);
        if (held == null) {
            return CapabilityCheck.deny("No capabilities registered for agent " + agentId);
        }
        if (CapabilityMatcher.matchesAny(held, required)) {
            log.debug("Capability granted [agent={}, required={}]", agentId, required);
            return CapabilityCheck.grant();
        }
        return CapabilityCheck.deny("Agent " + agentId + " does not have capability: " + required);
    }

    /** First denial among {@code required}, or a grant when all are satisfied. */
    public CapabilityCheck checkAll(String agentId, Collection<Capability> required) {
        for (Capability capability : required) {
            CapabilityCheck result = check(agentId, capability);
            if (!result.granted()) return result;
        }
        return CapabilityCheck.grant();
    }

    public List<Capability> list(String agentId) {
        return grants.getOrDefault(agentId, List.of());
    }

    /** Largest LlmMaxTokens bound held by the agent, if any. */
    public OptionalLong maxTokenBound(String agentId) {
        return list(agentId).stream()
                .filter(c -> c.type() == CapabilityType.LLM_MAX_TOKENS)
                .mapToLong(Capability::bound)
                .max();
    }

    public void revoke(String agentId) {
        if (grants.remove(agentId) != null) {
            log.info("Revoked all capabilities [agent={}]", agentId);
        }
    }
}
