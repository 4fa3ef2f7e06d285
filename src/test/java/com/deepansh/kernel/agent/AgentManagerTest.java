package com.deepansh.kernel.agent;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityDeniedException;
import com.deepansh.kernel.capability.CapabilityManager;
import com.deepansh.kernel.capability.PrivilegeEscalationException;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.model.Message;
import com.deepansh.kernel.quota.QuotaScheduler;
import com.deepansh.kernel.support.InMemorySessionStore;
import com.deepansh.kernel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentManagerTest {

    private KernelProperties properties;
    private CapabilityManager capabilityManager;
    private QuotaScheduler quotaScheduler;
    private InMemorySessionStore sessionStore;
    private AgentManager agentManager;

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        capabilityManager = new CapabilityManager();
        quotaScheduler = new QuotaScheduler(clock, properties);
        sessionStore = new InMemorySessionStore();
        agentManager = new AgentManager(capabilityManager, quotaScheduler, sessionStore, properties, clock);
    }

    @Test
    void rootSpawn_appliesDefaultsAndGrantsManifestCapabilities() {
        AgentRecord agent = agentManager.spawn(manifest("root", Capability.fileRead("/data/*")), null);

        assertThat(agent.getParentId()).isNull();
        assertThat(agent.getModel()).isEqualTo(properties.getLoop().getDefaultModel());
        assertThat(agent.getSystemPrompt()).isEqualTo(properties.getLoop().getSystemPrompt());
        assertThat(agent.getHourlyTokenLimit()).isEqualTo(properties.getQuota().getDefaultHourlyTokens());
        assertThat(agent.getMaxConcurrentTools()).isEqualTo(properties.getTools().getMaxConcurrent());
        assertThat(capabilityManager.list(agent.getAgentId())).containsExactly(Capability.fileRead("/data/*"));
        assertThat(agentManager.list()).containsExactly(agent);
    }

    @Test
    void childSpawn_withinParentGrants_succeeds() {
        AgentRecord parent = agentManager.spawn(
                manifest("parent", Capability.agentSpawn(), Capability.fileRead("/data/*")), null);

        AgentRecord child = agentManager.spawn(
                manifest("child", Capability.fileRead("/data/reports/*")), parent.getAgentId());

        assertThat(child.getParentId()).isEqualTo(parent.getAgentId());
        assertThat(capabilityManager.check(child.getAgentId(), Capability.fileRead("/data/reports/q1.csv"))
                .granted()).isTrue();
    }

    @Test
    void childSpawn_inheritsParentTokenBoundWhenOmitted() {
        AgentRecord parent = agentManager.spawn(
                manifest("capped", Capability.toolAll(), Capability.agentSpawn(), Capability.llmMaxTokens(100)), null);

        AgentRecord child = agentManager.spawn(manifest("child", Capability.toolAll()), parent.getAgentId());

        assertThat(capabilityManager.maxTokenBound(child.getAgentId())).hasValue(100);
        assertThat(child.getCapabilities()).containsExactly(Capability.toolAll(), Capability.llmMaxTokens(100));
    }

    @Test
    void childSpawn_askingForMoreThanParent_isRejectedWithoutSideEffects() {
        AgentRecord parent = agentManager.spawn(
                manifest("parent", Capability.agentSpawn(), Capability.fileRead("/data/*")), null);

        assertThatThrownBy(() -> agentManager.spawn(
                manifest("greedy", Capability.shellExec("*")), parent.getAgentId()))
                .isInstanceOf(PrivilegeEscalationException.class);

        assertThat(agentManager.list()).containsExactly(parent);
    }

    @Test
    void childSpawn_fromParentWithoutAgentSpawn_isDenied() {
        AgentRecord parent = agentManager.spawn(manifest("parent", Capability.fileRead("/data/*")), null);

        assertThatThrownBy(() -> agentManager.spawn(
                manifest("child", Capability.fileRead("/data/*")), parent.getAgentId()))
                .isInstanceOf(CapabilityDeniedException.class);
        assertThat(agentManager.list()).hasSize(1);
    }

    @Test
    void childSpawn_fromUnknownParent_throwsNotFound() {
        assertThatThrownBy(() -> agentManager.spawn(manifest("orphan"), "missing"))
                .isInstanceOf(AgentNotFoundException.class);
    }

    @Test
    void kill_revokesGrantsAndDeletesSession() {
        AgentRecord agent = agentManager.spawn(manifest("doomed", Capability.toolAll()), null);
        sessionStore.save(agent.getSessionId(), List.of(Message.user("hello")));

        agentManager.kill(agent.getAgentId());

        assertThat(agentManager.find(agent.getAgentId())).isEmpty();
        assertThat(capabilityManager.list(agent.getAgentId())).isEmpty();
        assertThat(sessionStore.contains(agent.getSessionId())).isFalse();
        assertThatThrownBy(() -> agentManager.kill(agent.getAgentId()))
                .isInstanceOf(AgentNotFoundException.class);
    }

    @Test
    void manifestLimit_overridesDefaultQuota() {
        AgentManifest manifest = manifest("small");
        manifest.setHourlyTokenLimit(5_000L);

        AgentRecord agent = agentManager.spawn(manifest, null);

        assertThat(quotaScheduler.usage(agent.getAgentId()).limit()).isEqualTo(5_000L);
    }

    private static AgentManifest manifest(String name, Capability... capabilities) {
        return AgentManifest.builder()
                .name(name)
                .capabilities(new ArrayList<>(List.of(capabilities)))
                .build();
    }
}
