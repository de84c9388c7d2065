package com.sandstormtracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

// ========== Tracker Configuration ==========
@ConfigurationProperties(prefix = "tracker")
@Validated
@Data
public class TrackerProperties {

    @Valid
    private List<ServerProperties> servers = new ArrayList<>();

    @Valid
    private Watcher watcher = new Watcher();

    @Valid
    private Catchup catchup = new Catchup();

    @Valid
    private Scores scores = new Scores();

    @Valid
    private Rcon rcon = new Rcon();

    public List<ServerProperties> enabledServers() {
        return servers.stream()
            .filter(ServerProperties::isEnabled)
            .toList();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServerProperties {
        private String id;
        private String name;

        @NotBlank
        private String logPath;

        private String rconAddress;
        private String rconPassword;

        @Builder.Default
        private boolean enabled = true;

        /**
         * Server id as configured, falling back to the log filename without its extension.
         */
        public String resolveId() {
            if (id != null && !id.isBlank()) {
                return id;
            }
            String fileName = Path.of(logPath).getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            return dot > 0 ? fileName.substring(0, dot) : fileName;
        }

        public String resolveName() {
            return name != null && !name.isBlank() ? name : resolveId();
        }
    }

    @Data
    public static class Watcher {
        @NotNull
        private Duration coalesceWindow = Duration.ofMillis(200);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(2);
        @NotNull
        private Duration inactivityTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration disconnectSuppressionWindow = Duration.ofSeconds(10);
    }

    @Data
    public static class Catchup {
        private boolean enabled = true;
        @NotNull
        private Duration shortThreshold = Duration.ofMinutes(1);
        @NotNull
        private Duration longThreshold = Duration.ofHours(6);
        @NotNull
        private Duration livenessWindow = Duration.ofSeconds(30);
        @NotNull
        private Duration markerWindow = Duration.ofMinutes(30);
        private int tailLines = 100;
    }

    @Data
    public static class Scores {
        @NotNull
        private Duration debounceWindow = Duration.ofSeconds(10);
        @NotNull
        private Duration maxWait = Duration.ofSeconds(25);
        @NotNull
        private Duration objectiveDelay = Duration.ofSeconds(10);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Rcon {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }
}
