package com.clan.clears.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 所有 {@code clears.*} 配置的强类型绑定。
 *
 * <pre>
 * clears:
 *   upstream:
 *     base-url: https://www.bungie.net/Platform
 *     api-key: ...
 *     clan-id: ...
 *     timeout: 8s
 *     retries: 2
 *     backoff-base: 500ms
 *     page-size: 250
 *     max-pages: 50
 *   refresh:
 *     concurrency: 2
 *     min-interval: 5m
 *   jobs:
 *     lease-ttl: 10m
 *     retry-delay: 15s
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "clears")
public class ClearsProperties {

    @NestedConfigurationProperty
    private Upstream upstream = new Upstream();

    @NestedConfigurationProperty
    private Refresh refresh = new Refresh();

    @NestedConfigurationProperty
    private Jobs jobs = new Jobs();

    @NestedConfigurationProperty
    private Members members = new Members();

    @NestedConfigurationProperty
    private Gateway gateway = new Gateway();

    @NestedConfigurationProperty
    private Pgcr pgcr = new Pgcr();

    @NestedConfigurationProperty
    private Schedule schedule = new Schedule();

    @NestedConfigurationProperty
    private Admin admin = new Admin();

    @NestedConfigurationProperty
    private Web web = new Web();

    @Data
    public static class Upstream {
        private String baseUrl = "https://www.bungie.net/Platform";
        private String apiKey = "";
        private String clanId = "";
        /** 单次请求超时。 */
        private Duration timeout = Duration.ofMillis(8000);
        /** 临时失败在首次尝试之后的重试次数。 */
        private int retries = 2;
        private Duration backoffBase = Duration.ofMillis(500);
        private int pageSize = 250;
        /** 每个（角色，模式）组合的历史页数上限。 */
        private int maxPages = 50;
    }

    @Data
    public static class Refresh {
        /** 同时处理的成员数。 */
        private int concurrency = 2;
        private Duration batchPause = Duration.ofMillis(200);
        private Duration memberTimeout = Duration.ofSeconds(120);
        /** 两次成功统计刷新之间的最小间隔，强制刷新除外。 */
        private Duration minInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Jobs {
        private Duration leaseTtl = Duration.ofMinutes(10);
        private Duration retryDelay = Duration.ofMillis(15000);
        private int maxAttempts = 10;
        private int runnerThreads = 4;
        private int mailboxThreads = 4;
        private boolean recoverOnStartup = true;
    }

    @Data
    public static class Members {
        private int emblemBatchSize = 5;
        private Duration emblemBatchPause = Duration.ofMillis(200);
    }

    @Data
    public static class Gateway {
        private Duration syncWaitTimeout = Duration.ofSeconds(60);
        /** 同步刷新可覆盖的成员上限。 */
        private int syncMemberCap = 25;
    }

    @Data
    public static class Pgcr {
        private Duration cacheTtl = Duration.ofHours(24);
    }

    @Data
    public static class Schedule {
        private String cron = "0 */15 * * * *";
        /** 统计刷新触发与成员刷新触发之间的延迟。 */
        private Duration membersStagger = Duration.ofSeconds(30);
    }

    @Data
    public static class Admin {
        private String token = "";
    }

    @Data
    public static class Web {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8000"));
    }
}
