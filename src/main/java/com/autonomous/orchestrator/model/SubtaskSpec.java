package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskSpec {
    private String taskId;
    private String description;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    @Builder.Default
    private List<String> requiredCapabilities = new ArrayList<>();

    public static SubtaskSpec of(String taskId, String description, String... dependencies) {
        return SubtaskSpec.builder()
            .taskId(taskId)
            .description(description)
            .dependencies(new ArrayList<>(List.of(dependencies)))
            .build();
    }
}
