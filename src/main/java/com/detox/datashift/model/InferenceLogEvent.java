package com.detox.datashift.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw inference log payload as written by the detoxification service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InferenceLogEvent {

    @JsonProperty("input_text")
    private String inputText;

    @JsonProperty("language_id")
    private String languageId;

    @JsonProperty("detoxified_text")
    private String detoxifiedText;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("model_used")
    private String modelUsed;

    public LogRecord toLogRecord(Instant fallbackTimestamp) {
        return LogRecord.builder()
                .text(inputText)
                .languageId(languageId)
                .detoxifiedText(detoxifiedText)
                .timestamp(timestamp != null ? timestamp : fallbackTimestamp)
                .requestId(requestId)
                .modelUsed(modelUsed)
                .build();
    }
}
