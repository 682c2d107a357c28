package airbrake.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the Airbrake notifier.
 *
 * @see AirbrakeAutoConfiguration
 */
@ConfigurationProperties(prefix = "airbrake")
public class AirbrakeProperties {

    /**
     * Whether to create the notifier bean.
     */
    private boolean enabled = true;

    /**
     * Project id from the Airbrake project settings.
     */
    private long projectId;

    /**
     * Project API key.
     */
    private String projectKey;

    /**
     * Collector base URL.
     */
    private String host = "https://api.airbrake.io";

    /**
     * Environment name attached to every notice, e.g. "production".
     */
    private String environment;

    /**
     * Environments whose notices are never sent.
     */
    private List<String> ignoreEnvironments = new ArrayList<>();

    /**
     * Keys whose values are replaced with "[Filtered]".
     */
    private List<String> blacklistKeys = new ArrayList<>();

    /**
     * Keys whose values are kept; every other value is replaced with "[Filtered]".
     */
    private List<String> whitelistKeys = new ArrayList<>();

    private String rootDirectory;

    private String appVersion;

    /**
     * Network timeout per request.
     */
    private Duration timeout = Duration.ofSeconds(10);

    private final Async async = new Async();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getProjectId() {
        return projectId;
    }

    public void setProjectId(long projectId) {
        this.projectId = projectId;
    }

    public String getProjectKey() {
        return projectKey;
    }

    public void setProjectKey(String projectKey) {
        this.projectKey = projectKey;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public List<String> getIgnoreEnvironments() {
        return ignoreEnvironments;
    }

    public void setIgnoreEnvironments(List<String> ignoreEnvironments) {
        this.ignoreEnvironments = ignoreEnvironments;
    }

    public List<String> getBlacklistKeys() {
        return blacklistKeys;
    }

    public void setBlacklistKeys(List<String> blacklistKeys) {
        this.blacklistKeys = blacklistKeys;
    }

    public List<String> getWhitelistKeys() {
        return whitelistKeys;
    }

    public void setWhitelistKeys(List<String> whitelistKeys) {
        this.whitelistKeys = whitelistKeys;
    }

    public String getRootDirectory() {
        return rootDirectory;
    }

    public void setRootDirectory(String rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public void setAppVersion(String appVersion) {
        this.appVersion = appVersion;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Async getAsync() {
        return async;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Async {
        /**
         * Number of background delivery workers. 0 delivers every notice synchronously.
         */
        private int workers = 1;

        /**
         * Capacity of the async queue.
         */
        private int queueSize = 100;

        /**
         * How long shutdown waits for queued notices.
         */
        private Duration drainTimeout = Duration.ofSeconds(5);

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueSize() {
            return queueSize;
        }

        public void setQueueSize(int queueSize) {
            this.queueSize = queueSize;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "airbrake";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
