package com.deepansh.kernel.tool;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityManager;
import com.deepansh.kernel.sandbox.SandboxModuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves tool names to dispatch routes.
 *
 * Spring auto-discovers every @Component that implements AgentTool; sandbox modules
 * come from {@link SandboxModuleRegistry}. In-process tools win on a name clash.
 *
 * The catalogue an agent sees is filtered by its ToolInvoke grants, so a model is never
 * shown a tool it cannot call.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();
    private final SandboxModuleRegistry sandboxModules;
    private final CapabilityManager capabilityManager;

    public ToolRegistry(List<AgentTool> toolBeans,
                        SandboxModuleRegistry sandboxModules,
                        CapabilityManager capabilityManager) {
        this.sandboxModules = sandboxModules;
        this.capabilityManager = capabilityManager;
        toolBeans.forEach(tool -> {
            tools.put(tool.getName(), tool);
            log.info("Registered tool: [{}] ({})", tool.getName(), tool.getKind());
        });
        log.info("Total in-process tools registered: {}", tools.size());
    }

    public Optional<ToolRoute> resolve(String name) {
        if (name == null) return Optional.empty();
        AgentTool tool = tools.get(name);
        if (tool != null) {
            return Optional.of(ToolRoute.of(tool));
        }
        return sandboxModules.find(name).map(ToolRoute::of);
    }

    public List<ToolDefinition> allDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        tools.values().forEach(t -> definitions.add(ToolDefinition.from(t)));
        sandboxModules.all().stream()
                .filter(m -> !tools.containsKey(m.name()))
                .forEach(m -> definitions.add(ToolDefinition.from(m)));
        definitions.sort(Comparator.comparing(ToolDefinition::getName));
        return definitions;
    }

    /** Only the tools {@code agentId} holds ToolInvoke (or ToolAll) for. */
    public List<ToolDefinition> definitionsFor(String agentId) {
        return allDefinitions().stream()
                .filter(d -> capabilityManager.check(agentId, Capability.toolInvoke(d.getName())).granted())
                .toList();
    }

    public List<String> toolNames() {
        return allDefinitions().stream().map(ToolDefinition::getName).toList();
    }
}
