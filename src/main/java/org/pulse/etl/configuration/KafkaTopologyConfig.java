package org.pulse.etl.configuration;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.pulse.etl.models.enums.EtlStage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.Arrays;

/**
 * Declares one durable topic per pipeline stage. {@link KafkaAdmin} creates any
 * that are missing when the context starts.
 */
@EnableKafka
@Configuration
public class KafkaTopologyConfig {

    @Bean
    public KafkaAdmin.NewTopics etlStageTopics(EtlProperties properties) {
        EtlProperties.Queue queue = properties.getQueue();
        return new KafkaAdmin.NewTopics(Arrays.stream(EtlStage.values())
                .map(stage -> TopicBuilder.name(queue.topicFor(stage.routingKey()))
                        .partitions(queue.getPartitions())
                        .replicas(queue.getReplicas())
                        .config(TopicConfig.RETENTION_MS_CONFIG, Long.toString(queue.getRetention().toMillis()))
                        .build())
                .toArray(NewTopic[]::new));
    }
}
