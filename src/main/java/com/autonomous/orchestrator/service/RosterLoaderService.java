package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentProfile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Loads the agent roster, one YAML profile per file. Files are read in name
 * order so the roster order (and with it agent selection) is reproducible.
 */
@Slf4j
@Service
public class RosterLoaderService {

    @Value("${orchestrator.roster.path:config/agents}")
    private String rosterPath;

    private final ObjectMapper yamlMapper;

    public RosterLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setRosterPath(String path) {
        this.rosterPath = path;
    }

    public List<AgentProfile> loadRoster() {
        List<AgentProfile> roster = new ArrayList<>();
        File rosterDir = new File(rosterPath);

        if (!rosterDir.exists() || !rosterDir.isDirectory()) {
            log.info("Roster directory not found: {}, running with the fallback agent only", rosterPath);
            return roster;
        }

        File[] yamlFiles = rosterDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return roster;
        }
        Arrays.sort(yamlFiles, Comparator.comparing(File::getName));

        for (File file : yamlFiles) {
            try {
                AgentProfile profile = yamlMapper.readValue(file, AgentProfile.class);
                if (profile.getName() == null || profile.getName().isBlank()) {
                    log.warn("Skipping agent profile without a name: {}", file.getName());
                    continue;
                }
                roster.add(profile);
                log.info("Loaded agent profile: {} {}", profile.getName(), profile.getCapabilities());
            } catch (Exception e) {
                log.error("Failed to load agent profile from {}: {}", file.getName(), e.getMessage());
            }
        }
        return roster;
    }
}
