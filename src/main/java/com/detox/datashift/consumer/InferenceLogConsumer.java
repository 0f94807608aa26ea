package com.detox.datashift.consumer;

import com.detox.datashift.model.InferenceLogEvent;
import com.detox.datashift.model.LogRecord;
import com.detox.datashift.source.BufferedLogSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Kafka consumer that feeds inference log entries into the buffered log source.
 *
 * Offsets are committed manually once the record is buffered. A record that cannot
 * be parsed is not acknowledged and goes to the container's error handler, which
 * retries it and then skips it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InferenceLogConsumer {

    private final BufferedLogSource logSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @KafkaListener(
        topics = "${kafka.topics.inference-logs:llm-detox-inference-logs}",
        groupId = "${kafka.consumer.group-id:data-shift-monitor}",
        containerFactory = "inferenceLogListenerContainerFactory"
    )
    public void consumeInferenceLog(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        try {
            log.debug("Received inference log from partition {} at offset {}",
                record.partition(), record.offset());

            InferenceLogEvent event = objectMapper.readValue(record.value(), InferenceLogEvent.class);

            LogRecord logRecord = event.toLogRecord(fallbackTimestamp(record));
            logSource.append(logRecord);

            acknowledgment.acknowledge();

            log.debug("Buffered inference log {} from partition {} offset {}",
                event.getRequestId(), record.partition(), record.offset());

        } catch (Exception e) {
            log.error("Error processing inference log from partition {} offset {}: {}",
                record.partition(), record.offset(), record.value(), e);
            // Don't acknowledge - will be retried
            throw new RuntimeException("Failed to process inference log", e);
        }
    }

    /**
     * Payloads without their own timestamp take the broker timestamp, or the
     * arrival time when the record has none.
     */
    private Instant fallbackTimestamp(ConsumerRecord<String, String> record) {
        return record.timestamp() >= 0
                ? Instant.ofEpochMilli(record.timestamp())
                : clock.instant();
    }
}
