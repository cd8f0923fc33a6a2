package net.kairos.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("kairos")
public class KairosProperties {
    private String endpoint = "cloudscheduler.googleapis.com:443";
    private String audience = "https://cloudscheduler.googleapis.com/";
    private int poolSize = 1;
    private Connection connection = new Connection();
    private Auth auth = new Auth();
    private Retry retry = new Retry();
    private Catalog catalog = new Catalog();

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Connection getConnection() {
        return connection;
    }

    public void setConnection(Connection connection) {
        this.connection = connection;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Connection {
        private boolean plaintext = false;
        private Duration callTimeout;           // 시도 1회 deadline, 비우면 없음
        private Duration keepAliveTime;
        private Duration idleTimeout;
        private int maxInboundMessageSize = Integer.MAX_VALUE;
        private String userAgent = "kairos";

        public boolean isPlaintext() {
            return plaintext;
        }

        public void setPlaintext(boolean plaintext) {
            this.plaintext = plaintext;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Duration getKeepAliveTime() {
            return keepAliveTime;
        }

        public void setKeepAliveTime(Duration keepAliveTime) {
            this.keepAliveTime = keepAliveTime;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public int getMaxInboundMessageSize() {
            return maxInboundMessageSize;
        }

        public void setMaxInboundMessageSize(int maxInboundMessageSize) {
            this.maxInboundMessageSize = maxInboundMessageSize;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class Auth {
        private String token; // 고정 bearer 토큰. 없으면 인증 헤더 없음

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Retry {
        private Duration initialDelay = Duration.ofMillis(50);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double backoffFactor = 1.0;
        private int maxAttempts = 20;
        private List<String> retryableCodes = new ArrayList<>(List.of("UNAVAILABLE", "UNKNOWN"));

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<String> getRetryableCodes() {
            return retryableCodes;
        }

        public void setRetryableCodes(List<String> retryableCodes) {
            this.retryableCodes = retryableCodes;
        }
    }

    public static class Catalog {
        private boolean enabled = false;
        private String parent;                         // projects/{project}/locations/{location}
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getParent() {
            return parent;
        }

        public void setParent(String parent) {
            this.parent = parent;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;        // jobId 또는 전체 리소스 이름
        private String description;
        private String schedule;
        private String timeZone;
        private String httpUri;
        private String httpMethod = "POST";
        private String pubsubTopic;
        private boolean paused = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public String getHttpUri() {
            return httpUri;
        }

        public void setHttpUri(String httpUri) {
            this.httpUri = httpUri;
        }

        public String getHttpMethod() {
            return httpMethod;
        }

        public void setHttpMethod(String httpMethod) {
            this.httpMethod = httpMethod;
        }

        public String getPubsubTopic() {
            return pubsubTopic;
        }

        public void setPubsubTopic(String pubsubTopic) {
            this.pubsubTopic = pubsubTopic;
        }

        public boolean isPaused() {
            return paused;
        }

        public void setPaused(boolean paused) {
            this.paused = paused;
        }

        @Override
        public String toString() {
            return "JobDef{name='" + name + "', schedule='" + schedule + "', timeZone='" + timeZone
                    + "', target=" + (httpUri != null ? httpMethod + " " + httpUri : pubsubTopic)
                    + ", paused=" + paused + "}";
        }
    }
}
