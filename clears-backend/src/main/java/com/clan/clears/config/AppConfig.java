package com.clan.clears.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * 基础设施 Bean：时钟、上游 HTTP 客户端以及 actor 使用的线程池。
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient upstreamRestClient(RestClient.Builder builder, ClearsProperties properties) {
        ClearsProperties.Upstream upstream = properties.getUpstream();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(upstream.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(upstream.getTimeout());

        return builder
                .baseUrl(upstream.getBaseUrl())
                .defaultHeader("X-API-Key", upstream.getApiKey())
                .requestFactory(requestFactory)
                .build();
    }

    /** 耗时较长的成员任务执行。 */
    @Bean
    public ThreadPoolTaskExecutor jobRunnerExecutor(ClearsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getJobs().getRunnerThreads());
        executor.setMaxPoolSize(properties.getJobs().getRunnerThreads());
        executor.setThreadNamePrefix("job-runner-");
        return executor;
    }

    /** 成员 actor 的短小状态迁移。 */
    @Bean
    public ThreadPoolTaskExecutor mailboxExecutor(ClearsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getJobs().getMailboxThreads());
        executor.setMaxPoolSize(properties.getJobs().getMailboxThreads());
        executor.setThreadNamePrefix("actor-mailbox-");
        return executor;
    }

    /** 快照协调者等待成员任务时会阻塞，使用独立线程。 */
    @Bean
    public ThreadPoolTaskExecutor coordinatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("coordinator-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("clears-scheduler-");
        return scheduler;
    }
}
