package com.chatty.synth.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizing for the executor that runs helper-seat backend calls. Each synthesis request
 * submits one task per helper seat, so the core size should be a multiple of three.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private HelperPoolProperties helper = new HelperPoolProperties();

    public HelperPoolProperties getHelper() {
        return helper;
    }

    public void setHelper(HelperPoolProperties helper) {
        this.helper = helper;
    }

    /**
     * Helper executor pool configuration.
     */
    public static class HelperPoolProperties {
        private int corePoolSize = 6;
        private int maxPoolSize = 12;
        private int queueCapacity = 60;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "helper-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
