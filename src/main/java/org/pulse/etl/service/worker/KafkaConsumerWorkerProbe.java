package org.pulse.etl.service.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.ConsumerGroupDescription;
import org.pulse.etl.configuration.EtlProperties;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Workers are considered available when the in-process listener container runs
 * or, failing that, when the broker reports live members in the worker consumer group.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaConsumerWorkerProbe implements WorkerStatusProbe {

    private final KafkaListenerEndpointRegistry listenerRegistry;
    private final KafkaAdmin kafkaAdmin;
    private final EtlProperties properties;

    @Override
    public boolean isRunning() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(TransformWorker.LISTENER_ID);
        if (container != null && container.isRunning()) {
            return true;
        }
        return groupHasMembers(properties.getQueue().getWorkerGroup());
    }

    private boolean groupHasMembers(String group) {
        try (AdminClient admin = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            ConsumerGroupDescription description = admin.describeConsumerGroups(List.of(group))
                    .describedGroups()
                    .get(group)
                    .get(properties.getQueue().getPublishTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Consumer group {} has {} member(s)", group, description.members().size());
            return !description.members().isEmpty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while describing consumer group " + group, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Could not describe consumer group " + group, e);
        }
    }
}
