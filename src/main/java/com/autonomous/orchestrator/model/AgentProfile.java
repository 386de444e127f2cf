package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
public class AgentProfile {
    private String name;
    private String description;
    private String model;
    private List<String> capabilities = new ArrayList<>();
    private List<String> phaseAffinity = new ArrayList<>();
    private Map<String, Object> configuration;

    public static AgentProfile of(String name, String... capabilities) {
        AgentProfile profile = new AgentProfile();
        profile.setName(name);
        profile.setCapabilities(new ArrayList<>(List.of(capabilities)));
        return profile;
    }
}
