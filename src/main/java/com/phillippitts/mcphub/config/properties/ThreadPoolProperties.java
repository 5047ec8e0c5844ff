package com.phillippitts.mcphub.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the backend call pool.
 *
 * <p>Backend health probes and invocations run on this pool so the task worker can wait on
 * them with a timeout. The task worker pool itself is sized by {@link TaskProperties}.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private BackendPoolProperties backend = new BackendPoolProperties();

    public BackendPoolProperties getBackend() {
        return backend;
    }

    public void setBackend(BackendPoolProperties backend) {
        this.backend = backend;
    }

    /**
     * Backend executor pool configuration.
     */
    public static class BackendPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "backend-";

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
