package com.deepansh.kernel.agent;

import com.deepansh.kernel.capability.Capability;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What an agent is asked to be at spawn time. Null overrides fall back to the
 * kernel defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentManifest {

    @NotBlank
    private String name;

    private String systemPrompt;
    private String model;

    @NotNull
    @Builder.Default
    private List<Capability> capabilities = new ArrayList<>();

    @Positive
    private Long hourlyTokenLimit;

    @Positive
    private Integer maxConcurrentTools;
}
