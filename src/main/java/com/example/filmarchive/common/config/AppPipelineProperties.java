package com.example.filmarchive.common.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class AppPipelineProperties {

    private boolean enabled = true;

    private List<String> inputDirs = new ArrayList<>(Arrays.asList("./input"));

    @NotBlank
    private String archivedDir = "./analysed";

    @NotBlank
    private String outputDir = "./output";

    /**
     * Quiet period a file size must hold before the file counts as fully written.
     */
    @DecimalMin("0.0")
    private double debounceSeconds = 2.0D;

    @DecimalMin("0.0")
    private double outputDebounceSeconds = 0.5D;

    @Min(50)
    private long pollIntervalMs = 1000L;

    @Min(1)
    private int workerThreads = 2;

    @Min(1)
    private int workerQueueSize = 256;

    /**
     * How long shutdown waits for the in-flight file before giving up.
     */
    @Min(1)
    private int shutdownTimeoutSec = 600;

    /**
     * Delay between attempts to start watchers whose directory could not be prepared.
     */
    @Min(1000)
    private long watcherRetryIntervalMs = 30000L;

    @Min(1000)
    private long telemetryIntervalMs = 60000L;

    public List<Path> inputDirectories() {
        Set<String> unique = inputDirs.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .flatMap(item -> Arrays.stream(item.split(",")))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return unique.stream().map(Paths::get).collect(Collectors.toList());
    }

    public Path archivedDirectory() {
        return Paths.get(archivedDir);
    }

    public Path outputDirectory() {
        return Paths.get(outputDir);
    }
}
