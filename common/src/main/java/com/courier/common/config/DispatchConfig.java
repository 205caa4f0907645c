/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.config;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable dispatch settings for one connection type. Built once at startup and
 * handed to the dispatcher, the broadcast enricher and the event router.
 *
 * @param discriminatorField              wire field selecting the message type
 * @param completionSignalsEnabled        emit {@code complete} / {@code group_complete} after each unit of work
 * @param ignoredDiscriminatorsForLogging discriminators whose traffic is never logged
 * @param logReceivedMessages             log inbound frames at INFO
 * @param logSentMessages                 log outbound frames at INFO
 * @param sendAuthenticationMessage       send an {@code authentication} status frame after the auth gate
 * @param notifyUnicastEventErrors        report event routing failures to the target connection of a unicast event
 */
public record DispatchConfig(String discriminatorField,
                             boolean completionSignalsEnabled,
                             Set<String> ignoredDiscriminatorsForLogging,
                             boolean logReceivedMessages,
                             boolean logSentMessages,
                             boolean sendAuthenticationMessage,
                             boolean notifyUnicastEventErrors) {

    public static final String DEFAULT_DISCRIMINATOR_FIELD = "action";

    public DispatchConfig {
        Objects.requireNonNull(discriminatorField, "discriminatorField");
        if (discriminatorField.isBlank()) {
            throw new IllegalArgumentException("discriminatorField must not be blank");
        }
        ignoredDiscriminatorsForLogging = ignoredDiscriminatorsForLogging == null
                ? Set.of() : Set.copyOf(ignoredDiscriminatorsForLogging);
    }

    public static DispatchConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isIgnoredForLogging(String discriminator) {
        return discriminator != null && ignoredDiscriminatorsForLogging.contains(discriminator);
    }

    public Builder toBuilder() {
        return new Builder()
                .discriminatorField(discriminatorField)
                .completionSignalsEnabled(completionSignalsEnabled)
                .ignoredDiscriminatorsForLogging(ignoredDiscriminatorsForLogging)
                .logReceivedMessages(logReceivedMessages)
                .logSentMessages(logSentMessages)
                .sendAuthenticationMessage(sendAuthenticationMessage)
                .notifyUnicastEventErrors(notifyUnicastEventErrors);
    }

    public static final class Builder {
        private String discriminatorField = DEFAULT_DISCRIMINATOR_FIELD;
        private boolean completionSignalsEnabled = false;
        private Set<String> ignoredDiscriminatorsForLogging = Set.of();
        private boolean logReceivedMessages = true;
        private boolean logSentMessages = true;
        private boolean sendAuthenticationMessage = true;
        private boolean notifyUnicastEventErrors = false;

        private Builder() {}

        public Builder discriminatorField(String field) { this.discriminatorField = field; return this; }
        public Builder completionSignalsEnabled(boolean enabled) { this.completionSignalsEnabled = enabled; return this; }
        public Builder ignoredDiscriminatorsForLogging(Set<String> ignored) { this.ignoredDiscriminatorsForLogging = ignored; return this; }
        public Builder logReceivedMessages(boolean enabled) { this.logReceivedMessages = enabled; return this; }
        public Builder logSentMessages(boolean enabled) { this.logSentMessages = enabled; return this; }
        public Builder sendAuthenticationMessage(boolean enabled) { this.sendAuthenticationMessage = enabled; return this; }
        public Builder notifyUnicastEventErrors(boolean enabled) { this.notifyUnicastEventErrors = enabled; return this; }

        public DispatchConfig build() {
            return new DispatchConfig(discriminatorField, completionSignalsEnabled, ignoredDiscriminatorsForLogging,
                    logReceivedMessages, logSentMessages, sendAuthenticationMessage, notifyUnicastEventErrors);
        }
    }
}
