package com.detox.datashift.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Locale;

/**
 * One inference request as seen by the aggregator.
 *
 * Blank strings are normalized to null so that "absent" has a single meaning.
 * Text length counts Unicode code points, not UTF-16 chars.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LogRecord {

    private final String text;
    private final Integer textLength;
    private final String languageId;
    private final String detoxifiedText;
    private final Instant timestamp;
    private final String requestId;
    private final String modelUsed;

    @Builder
    private LogRecord(
            String text,
            String languageId,
            String detoxifiedText,
            Instant timestamp,
            String requestId,
            String modelUsed
    ) {
        this.text = blankToNull(text);
        this.textLength = this.text != null
                ? this.text.codePointCount(0, this.text.length())
                : null;
        String language = blankToNull(languageId);
        this.languageId = language != null ? language.trim().toLowerCase(Locale.ROOT) : null;
        this.detoxifiedText = blankToNull(detoxifiedText);
        this.timestamp = timestamp;
        this.requestId = requestId;
        this.modelUsed = modelUsed;
    }

    /**
     * A record without input text and without a language code carries nothing to aggregate.
     */
    public boolean isValid() {
        return text != null || languageId != null;
    }

    public boolean hasLanguage() {
        return languageId != null;
    }

    /**
     * Both sides of the rewrite are present, so the pair can be quality-scored.
     */
    public boolean isScorable() {
        return text != null && detoxifiedText != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
