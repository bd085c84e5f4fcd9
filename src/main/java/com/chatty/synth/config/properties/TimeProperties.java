package com.chatty.synth.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Time-awareness settings. Binds to properties prefixed with "synth.time".
 *
 * @param enabled when false no time context is produced for any request
 * @param defaultZone zone used when the request names none; blank means the JVM default
 */
@ConfigurationProperties(prefix = "synth.time")
public record TimeProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("") String defaultZone
) {
}
