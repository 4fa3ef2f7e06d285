package com.deepansh.kernel.tool;

import com.deepansh.kernel.capability.Capability;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Configurable in-process tool for dispatcher and loop tests. */
public class FakeTool implements AgentTool {

    @FunctionalInterface
    public interface Body {
        String run(Map<String, Object> arguments, ToolContext context) throws Exception;
    }

    private final String name;
    private final ToolKind kind;
    private final Function<Map<String, Object>, List<Capability>> requirements;
    private final Body body;

    public FakeTool(String name, ToolKind kind,
                    Function<Map<String, Object>, List<Capability>> requirements, Body body) {
        this.name = name;
        this.kind = kind;
        this.requirements = requirements;
        this.body = body;
    }

    public static FakeTool of(String name, Body body) {
        return new FakeTool(name, ToolKind.BUILTIN, args -> List.of(), body);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "Test tool " + name;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public ToolKind getKind() {
        return kind;
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return requirements.apply(arguments);
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        return body.run(arguments, context);
    }
}
