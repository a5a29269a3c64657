package io.webtimer4j.config;

import io.webtimer4j.core.ConfigException;
import io.webtimer4j.core.HttpMethod;
import io.webtimer4j.core.NotificationSettings;
import io.webtimer4j.core.RequestDefaults;
import io.webtimer4j.core.Schedule;
import io.webtimer4j.core.Trigger;
import io.webtimer4j.core.TriggerKind;
import io.webtimer4j.utils.TriggerParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration for the scheduled-request engine.
 */
@ConfigurationProperties(prefix = "webtimer")
public class WebTimerProperties {
    private boolean autoStart = false;
    private String applicationName = "WebRequestTimer";
    private String applicationVersion = "1.0";
    private int maxConcurrency = 20; // firings executing at once
    private Duration shutdownTimeout = Duration.ofMinutes(10);
    private String defaultTimezone;

    private final Http http = new Http();
    private final Notification notification = new Notification();
    private final History history = new History();
    private List<ScheduleDefinition> schedules = new ArrayList<>();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = applicationVersion;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public Http getHttp() {
        return http;
    }

    public Notification getNotification() {
        return notification;
    }

    public History getHistory() {
        return history;
    }

    public List<ScheduleDefinition> getSchedules() {
        return schedules;
    }

    public void setSchedules(List<ScheduleDefinition> schedules) {
        this.schedules = schedules == null ? new ArrayList<>() : schedules;
    }

    public RequestDefaults toRequestDefaults() {
        return new RequestDefaults(http.getDefaultTimeout(), http.getDefaultRetryCount(), http.getDefaultRetryDelay());
    }

    public NotificationSettings toNotificationSettings() {
        return new NotificationSettings(
                notification.isEnabled(),
                notification.getServerAddress(),
                notification.getPort(),
                notification.getDelay(),
                notification.isNotifyOnSuccess(),
                notification.isNotifyOnFailure(),
                notification.isNotifyOnResponseChange(),
                notification.getMaxResponseSizeBytes(),
                notification.isSuppressRepeatedFailures()
        );
    }

    public static class Http {
        private String userAgent = "WebRequestTimer/1.0";
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int defaultRetryCount = 3;
        private Duration defaultRetryDelay = Duration.ofSeconds(5);
        private boolean followRedirects = true;
        private boolean verifySsl = true;
        private int maxBodyBytes = 1024 * 1024;
        private Set<Integer> successStatusCodes = new LinkedHashSet<>();

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public int getDefaultRetryCount() {
            return defaultRetryCount;
        }

        public void setDefaultRetryCount(int defaultRetryCount) {
            this.defaultRetryCount = defaultRetryCount;
        }

        public Duration getDefaultRetryDelay() {
            return defaultRetryDelay;
        }

        public void setDefaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
        }

        public boolean isFollowRedirects() {
            return followRedirects;
        }

        public void setFollowRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
        }

        public boolean isVerifySsl() {
            return verifySsl;
        }

        public void setVerifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
        }

        public int getMaxBodyBytes() {
            return maxBodyBytes;
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
        }

        public Set<Integer> getSuccessStatusCodes() {
            return successStatusCodes;
        }

        public void setSuccessStatusCodes(Set<Integer> successStatusCodes) {
            this.successStatusCodes = successStatusCodes == null ? new LinkedHashSet<>() : successStatusCodes;
        }
    }

    public static class Notification {
        private boolean enabled = false;
        private String serverAddress = "localhost";
        private int port = 12345;
        private Duration delay = Duration.ofSeconds(1);
        private boolean notifyOnSuccess = true;
        private boolean notifyOnFailure = true;
        private boolean notifyOnResponseChange = true;
        private int maxResponseSizeBytes = 1024;
        private boolean suppressRepeatedFailures = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getServerAddress() {
            return serverAddress;
        }

        public void setServerAddress(String serverAddress) {
            this.serverAddress = serverAddress;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public boolean isNotifyOnSuccess() {
            return notifyOnSuccess;
        }

        public void setNotifyOnSuccess(boolean notifyOnSuccess) {
            this.notifyOnSuccess = notifyOnSuccess;
        }

        public boolean isNotifyOnFailure() {
            return notifyOnFailure;
        }

        public void setNotifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
        }

        public boolean isNotifyOnResponseChange() {
            return notifyOnResponseChange;
        }

        public void setNotifyOnResponseChange(boolean notifyOnResponseChange) {
            this.notifyOnResponseChange = notifyOnResponseChange;
        }

        public int getMaxResponseSizeBytes() {
            return maxResponseSizeBytes;
        }

        public void setMaxResponseSizeBytes(int maxResponseSizeBytes) {
            this.maxResponseSizeBytes = maxResponseSizeBytes;
        }

        public boolean isSuppressRepeatedFailures() {
            return suppressRepeatedFailures;
        }

        public void setSuppressRepeatedFailures(boolean suppressRepeatedFailures) {
            this.suppressRepeatedFailures = suppressRepeatedFailures;
        }
    }

    public static class History {
        private int maxHashedBytes = 1024 * 1024;
        private int maxStoredBodyBytes = 64 * 1024;
        private String collection = "request_history";
        private Duration retention = Duration.ofDays(30);
        private boolean ensureIndexesOnStartup = false;

        public int getMaxHashedBytes() {
            return maxHashedBytes;
        }

        public void setMaxHashedBytes(int maxHashedBytes) {
            this.maxHashedBytes = maxHashedBytes;
        }

        public int getMaxStoredBodyBytes() {
            return maxStoredBodyBytes;
        }

        public void setMaxStoredBodyBytes(int maxStoredBodyBytes) {
            this.maxStoredBodyBytes = maxStoredBodyBytes;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public boolean isEnsureIndexesOnStartup() {
            return ensureIndexesOnStartup;
        }

        public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
            this.ensureIndexesOnStartup = ensureIndexesOnStartup;
        }
    }

    /**
     * One entry of {@code webtimer.schedules}. Either {@code intervalSeconds} or {@code interval}
     * ("5m", "1 hour") sets an interval trigger; {@code cronExpression} sets a cron trigger.
     */
    public static class ScheduleDefinition {
        private String id;
        private String name;
        private boolean enabled = true;
        private String url;
        private String method = "GET";
        private Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private String scheduleType = "interval";
        private Long intervalSeconds;
        private String interval;
        private String cronExpression;
        private String timezone;
        private boolean runImmediately = false;
        private Duration timeout;
        private Integer retryCount;
        private Duration retryDelay;

        public Schedule toSchedule(String fallbackTimezone) {
            if (id == null || id.isBlank()) {
                throw new ConfigException("Required field 'id' is missing or empty");
            }
            TriggerKind kind = TriggerKind.fromConfig(scheduleType);
            Trigger trigger;
            if (kind == TriggerKind.CRON) {
                trigger = Trigger.cron(cronExpression, timezone != null ? timezone : fallbackTimezone);
            } else if (intervalSeconds != null) {
                trigger = Trigger.interval(intervalSeconds);
            } else if (interval != null) {
                trigger = Trigger.interval(TriggerParser.parseInterval(interval).toSeconds());
            } else {
                throw new ConfigException("interval seconds must be a positive number for interval schedule: " + id);
            }

            return Schedule.builder(id)
                    .name(name)
                    .enabled(enabled)
                    .url(url)
                    .method(HttpMethod.parse(method))
                    .headers(headers)
                    .body(body)
                    .trigger(trigger)
                    .runImmediately(runImmediately)
                    .timeout(timeout)
                    .retryCount(retryCount)
                    .retryDelay(retryDelay)
                    .build();
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }

        public String getScheduleType() {
            return scheduleType;
        }

        public void setScheduleType(String scheduleType) {
            this.scheduleType = scheduleType;
        }

        public Long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(Long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public void setCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isRunImmediately() {
            return runImmediately;
        }

        public void setRunImmediately(boolean runImmediately) {
            this.runImmediately = runImmediately;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Integer getRetryCount() {
            return retryCount;
        }

        public void setRetryCount(Integer retryCount) {
            this.retryCount = retryCount;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }
    }
}
