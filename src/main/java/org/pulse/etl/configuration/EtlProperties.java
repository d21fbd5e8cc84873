package org.pulse.etl.configuration;

import lombok.Getter;
import lombok.Setter;
import org.pulse.etl.models.enums.JobType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Watchdog watchdog = new Watchdog();
    private Extraction extraction = new Extraction();
    private Queue queue = new Queue();
    private Events events = new Events();
    private List<JobDefinition> jobs = new ArrayList<>();

    @Getter
    @Setter
    public static class Orchestrator {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(60);
        private Duration initialDelay = Duration.ofMinutes(1);
        private int maxRetries = 5;
        private boolean fastRetryEnabled = true;
    }

    @Getter
    @Setter
    public static class Watchdog {
        private Duration interval = Duration.ofMinutes(5);
        private Duration stuckCeiling = Duration.ofHours(2);
    }

    @Getter
    @Setter
    public static class Extraction {
        private int transientAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Queue {
        private String topicPrefix = "etl";
        private int partitions = 3;
        private int replicas = 1;
        private Duration publishTimeout = Duration.ofSeconds(10);
        private Duration retention = Duration.ofHours(24);
        private String workerGroup = "etl-transform-workers";
        private int workerConcurrency = 2;

        public String topicFor(String routingKey) {
            return topicPrefix + "." + routingKey;
        }
    }

    @Getter
    @Setter
    public static class Events {
        private int queueCapacity = 1000;
        private Duration emitterTimeout = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class JobDefinition {
        private String name;
        private JobType type;
        private Long tenantId = 1L;
        private Long integrationId;
        private boolean active = true;
        private int scheduleIntervalMinutes = 360;
        private int retryIntervalMinutes = 15;
        private Map<String, Object> config = new LinkedHashMap<>();
    }
}
