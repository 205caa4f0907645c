/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CourierPropertiesTest {

    @Test
    void defaultsMatchDispatchDefaults() {
        assertThat(new CourierProperties().toDispatchConfig()).isEqualTo(DispatchConfig.defaults());
        DispatchConfig defaults = DispatchConfig.defaults();
        assertThat(defaults.discriminatorField()).isEqualTo("action");
        assertThat(defaults.completionSignalsEnabled()).isFalse();
        assertThat(defaults.ignoredDiscriminatorsForLogging()).isEmpty();
    }

    @Test
    void bindsRelaxedPropertyNames() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "courier.dispatch.discriminator-field", "type",
                "courier.dispatch.completion-signals-enabled", "true",
                "courier.logging.ignored-discriminators", "ping,heartbeat",
                "courier.logging.log-sent-messages", "false",
                "courier.actor.system-name", "chat-node"));

        CourierProperties props = new Binder(source).bind("courier", CourierProperties.class).get();
        DispatchConfig config = props.toDispatchConfig();

        assertThat(config.discriminatorField()).isEqualTo("type");
        assertThat(config.completionSignalsEnabled()).isTrue();
        assertThat(config.logSentMessages()).isFalse();
        assertThat(config.isIgnoredForLogging("heartbeat")).isTrue();
        assertThat(config.isIgnoredForLogging("chat")).isFalse();
        assertThat(props.getActor().getSystemName()).isEqualTo("chat-node");
    }

    @Test
    void rejectsBlankDiscriminatorField() {
        assertThatThrownBy(() -> DispatchConfig.builder().discriminatorField(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
