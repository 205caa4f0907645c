/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.courier.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

    private Dispatch dispatch = new Dispatch();
    private Logging logging = new Logging();
    private Actor actor = new Actor();

    public static class Dispatch {
        private String discriminatorField = DispatchConfig.DEFAULT_DISCRIMINATOR_FIELD;
        private boolean completionSignalsEnabled = false;
        private boolean sendAuthenticationMessage = true;
        private boolean notifyUnicastEventErrors = false;

        public String getDiscriminatorField() { return discriminatorField; }
        public void setDiscriminatorField(String discriminatorField) { this.discriminatorField = discriminatorField; }
        public boolean isCompletionSignalsEnabled() { return completionSignalsEnabled; }
        public void setCompletionSignalsEnabled(boolean completionSignalsEnabled) { this.completionSignalsEnabled = completionSignalsEnabled; }
        public boolean isSendAuthenticationMessage() { return sendAuthenticationMessage; }
        public void setSendAuthenticationMessage(boolean sendAuthenticationMessage) { this.sendAuthenticationMessage = sendAuthenticationMessage; }
        public boolean isNotifyUnicastEventErrors() { return notifyUnicastEventErrors; }
        public void setNotifyUnicastEventErrors(boolean notifyUnicastEventErrors) { this.notifyUnicastEventErrors = notifyUnicastEventErrors; }
    }

    public static class Logging {
        private boolean logReceivedMessages = true;
        private boolean logSentMessages = true;
        private Set<String> ignoredDiscriminators = new LinkedHashSet<>();

        public boolean isLogReceivedMessages() { return logReceivedMessages; }
        public void setLogReceivedMessages(boolean logReceivedMessages) { this.logReceivedMessages = logReceivedMessages; }
        public boolean isLogSentMessages() { return logSentMessages; }
        public void setLogSentMessages(boolean logSentMessages) { this.logSentMessages = logSentMessages; }
        public Set<String> getIgnoredDiscriminators() { return ignoredDiscriminators; }
        public void setIgnoredDiscriminators(Set<String> ignoredDiscriminators) { this.ignoredDiscriminators = ignoredDiscriminators; }
    }

    public static class Actor {
        private String systemName = "courier";
        private long askTimeoutSeconds = 10;

        public String getSystemName() { return systemName; }
        public void setSystemName(String systemName) { this.systemName = systemName; }
        public long getAskTimeoutSeconds() { return askTimeoutSeconds; }
        public void setAskTimeoutSeconds(long askTimeoutSeconds) { this.askTimeoutSeconds = askTimeoutSeconds; }
    }

    /** Freezes the bound values into the immutable form the dispatch core consumes. */
    public DispatchConfig toDispatchConfig() {
        return DispatchConfig.builder()
                .discriminatorField(dispatch.getDiscriminatorField())
                .completionSignalsEnabled(dispatch.isCompletionSignalsEnabled())
                .sendAuthenticationMessage(dispatch.isSendAuthenticationMessage())
                .notifyUnicastEventErrors(dispatch.isNotifyUnicastEventErrors())
                .logReceivedMessages(logging.isLogReceivedMessages())
                .logSentMessages(logging.isLogSentMessages())
                .ignoredDiscriminatorsForLogging(logging.getIgnoredDiscriminators())
                .build();
    }

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Logging getLogging() { return logging; }
    public void setLogging(Logging logging) { this.logging = logging; }
    public Actor getActor() { return actor; }
    public void setActor(Actor actor) { this.actor = actor; }
}
