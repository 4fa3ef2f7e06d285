package com.deepansh.kernel.agent;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityManager;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.quota.QuotaScheduler;
import com.deepansh.kernel.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent lifecycle: spawn and kill.
 *
 * Spawn order matters: for a child agent the parent's AgentSpawn grant and the inheritance
 * rule are checked first, and only then are capabilities granted and the quota window
 * registered. A rejected spawn leaves no trace.
 */
@Service
@Slf4j
public class AgentManager {

    private final Map<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final CapabilityManager capabilityManager;
    private final QuotaScheduler quotaScheduler;
    private final SessionStore sessionStore;
    private final KernelProperties properties;
    private final Clock clock;

    public AgentManager(CapabilityManager capabilityManager,
                        QuotaScheduler quotaScheduler,
                        SessionStore sessionStore,
                        KernelProperties properties,
                        Clock clock) {
        this.capabilityManager = capabilityManager;
        this.quotaScheduler = quotaScheduler;
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param parentId spawning agent, or null when the orchestrator spawns a root agent
     * @throws AgentNotFoundException if the parent does not exist
     * @throws com.deepansh.kernel.capability.CapabilityDeniedException if the parent lacks AgentSpawn
     * @throws com.deepansh.kernel.capability.PrivilegeEscalationException if the child asks for more than the parent holds
     */
    public AgentRecord spawn(AgentManifest manifest, String parentId) {
        String agentId = UUID.randomUUID().toString();
        List<Capability> capabilities = manifest.getCapabilities() != null ? manifest.getCapabilities() : List.of();

        if (parentId != null) {
            get(parentId);
            capabilityManager.check(parentId, Capability.agentSpawn()).require();
            capabilities = capabilityManager.grantInherited(parentId, agentId, capabilities);
        } else {
            capabilityManager.grant(agentId, capabilities);
        }

        long limit = manifest.getHourlyTokenLimit() != null
                ? manifest.getHourlyTokenLimit()
                : properties.getQuota().getDefaultHourlyTokens();
        quotaScheduler.register(agentId, limit);

        AgentRecord record = AgentRecord.builder()
                .agentId(agentId)
                .name(manifest.getName())
                .parentId(parentId)
                .sessionId("session-" + agentId)
                .model(manifest.getModel() != null ? manifest.getModel() : properties.getLoop().getDefaultModel())
                .systemPrompt(manifest.getSystemPrompt() != null
                        ? manifest.getSystemPrompt()
                        : properties.getLoop().getSystemPrompt())
                .hourlyTokenLimit(limit)
                .maxConcurrentTools(manifest.getMaxConcurrentTools() != null
                        ? manifest.getMaxConcurrentTools()
                        : properties.getTools().getMaxConcurrent())
                .capabilities(List.copyOf(capabilities))
                .createdAt(clock.instant())
                .build();
        agents.put(agentId, record);

        log.info("Agent spawned [id={}, name={}, parent={}, capabilities={}]",
                agentId, manifest.getName(), parentId, capabilities);
        return record;
    }

    /** Revokes capabilities, drops the quota window and deletes the session. */
    public void kill(String agentId) {
        AgentRecord record = agents.remove(agentId);
        if (record == null) {
            throw new AgentNotFoundException(agentId);
        }
        capabilityManager.revoke(agentId);
        quotaScheduler.remove(agentId);
        sessionStore.delete(record.getSessionId());
        log.info("Agent killed [id={}, name={}]", agentId, record.getName());
    }

    public AgentRecord get(String agentId) {
        return find(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    public Optional<AgentRecord> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<AgentRecord> list() {
        return agents.values().stream()
                .sorted(Comparator.comparing(AgentRecord::getCreatedAt))
                .toList();
    }
}
