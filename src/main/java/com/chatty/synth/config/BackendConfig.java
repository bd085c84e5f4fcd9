package com.chatty.synth.config;

import com.chatty.synth.config.properties.BackendProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP client and clock beans.
 */
@Configuration
public class BackendConfig {

    /**
     * RestTemplate for backend calls with per-call connect and read timeouts from
     * {@code synth.backend.*}. The read timeout bounds a single helper call.
     */
    @Bean(name = "backendRestTemplate")
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, BackendProperties props) {
        return builder
                .setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.readTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
