package com.detox.datashift.consumer;

import com.detox.datashift.source.BufferedLogSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.event.ConsumerFailedToStartEvent;
import org.springframework.kafka.event.ConsumerStartedEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.ListenerContainerIdleEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.stereotype.Component;

/**
 * Translates Kafka container lifecycle events into log source availability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsumerLifecycleListener {

    private final BufferedLogSource logSource;

    @EventListener
    public void onConsumerStarted(ConsumerStartedEvent event) {
        log.info("Inference log consumer started");
        logSource.markAvailable();
    }

    @EventListener
    public void onConsumerStopped(ConsumerStoppedEvent event) {
        logSource.markUnavailable("consumer stopped (" + event.getReason() + ")");
    }

    @EventListener
    public void onConsumerFailedToStart(ConsumerFailedToStartEvent event) {
        logSource.markUnavailable("consumer failed to start");
    }

    /**
     * Published from the poll loop, so the consumer is alive even if nothing arrives.
     */
    @EventListener
    public void onContainerIdle(ListenerContainerIdleEvent event) {
        logSource.markAvailable();
    }

    @EventListener
    public void onNonResponsiveConsumer(NonResponsiveConsumerEvent event) {
        logSource.markUnavailable("consumer has not polled for " + event.getTimeSinceLastPoll() + " ms");
    }
}
