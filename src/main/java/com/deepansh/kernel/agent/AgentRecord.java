package com.deepansh.kernel.agent;

import com.deepansh.kernel.capability.Capability;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AgentRecord {

    String agentId;
    String name;
    /** Null for agents spawned by the orchestrator */
    String parentId;
    String sessionId;
    String model;
    String systemPrompt;
    long hourlyTokenLimit;
    int maxConcurrentTools;
    List<Capability> capabilities;
    Instant createdAt;
}
