/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.config;

import com.courier.common.config.CourierProperties;
import com.courier.common.config.DispatchConfig;
import com.courier.messaging.core.ChannelLayer;
import com.courier.messaging.memory.InMemoryChannelLayer;
import com.courier.server.actor.ConnectionHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Default wiring: bound properties, the frozen dispatch settings, an in-process
 * channel layer and the connection hub. Applications running several processes
 * replace the {@link ChannelLayer} bean with a broker-backed one.
 */
@Configuration
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CourierAutoConfiguration.class);

    @Bean
    public DispatchConfig dispatchConfig(CourierProperties properties) {
        DispatchConfig config = properties.toDispatchConfig();
        log.info("Dispatch config: discriminator '{}', completion signals {}",
                config.discriminatorField(), config.completionSignalsEnabled() ? "on" : "off");
        return config;
    }

    @Bean(destroyMethod = "close")
    public ChannelLayer channelLayer() {
        return new InMemoryChannelLayer();
    }

    @Bean(destroyMethod = "close")
    public ConnectionHub connectionHub(ChannelLayer channelLayer, CourierProperties properties) {
        CourierProperties.Actor actor = properties.getActor();
        return new ConnectionHub(channelLayer, actor.getSystemName(), Duration.ofSeconds(actor.getAskTimeoutSeconds()));
    }
}
