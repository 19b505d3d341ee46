package com.clan.clears.upstream;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * 单次上游调用的有限重试。429、5xx 和 I/O 失败（含超时）按指数退避加随机抖动重试；
 * 其他非 2xx 状态以及无法解析的响应体都是终态错误，立即抛出。
 */
@Component
public class RetryingFetcher {

    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    static final long MIN_DELAY_MS = 50;

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    @Autowired
    public RetryingFetcher(ClearsProperties properties) {
        this(properties, new ThreadWaitSleeper());
    }

    RetryingFetcher(ClearsProperties properties, Sleeper sleeper) {
        this.maxAttempts = Math.max(0, properties.getUpstream().getRetries()) + 1;

        ExponentialRandomBackOffPolicy backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(Math.max(MIN_DELAY_MS, properties.getUpstream().getBackoffBase().toMillis()));
        backOff.setMultiplier(2.0);
        backOff.setSleeper(sleeper);

        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new TransientFailurePolicy(maxAttempts));
        this.retryTemplate.setBackOffPolicy(backOff);
        this.retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                log.debug("上游调用失败（第 {}/{} 次）: {}",
                        context.getRetryCount(), maxAttempts, throwable.getMessage());
            }
        });
    }

    public <T> T execute(String description, Supplier<T> call) {
        try {
            return retryTemplate.execute(context -> attempt(description, call));
        } catch (UpstreamException e) {
            if (!e.isTransientFailure()) {
                throw e;
            }
            throw new UpstreamException(description + " exhausted " + maxAttempts + " attempts",
                    e.getStatus(), true, e);
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(description + " interrupted during backoff", 0, true, e);
        }
    }

    static boolean isTransient(int status) {
        return status == 429 || (status >= 500 && status < 600);
    }

    // 把 RestClient 的异常统一翻译成 UpstreamException，重试策略只看 transientFailure 标记
    private static <T> T attempt(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new UpstreamException(description + " returned " + status, status, isTransient(status), e);
        } catch (ResourceAccessException e) {
            throw new UpstreamException(description + " I/O failure: " + e.getMessage(), 0, true, e);
        } catch (RestClientException e) {
            // 2xx 但响应体无法解析（JSON 损坏或非 JSON 内容）
            throw new UpstreamException(description + " unreadable: " + e.getMessage(), 200, false, e);
        }
    }

    /**
     * 只重试 transientFailure 为 true 的 UpstreamException，次数上限同 SimpleRetryPolicy。
     */
    static class TransientFailurePolicy extends SimpleRetryPolicy {

        TransientFailurePolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            boolean retryable = last == null
                    || (last instanceof UpstreamException && ((UpstreamException) last).isTransientFailure());
            return retryable && context.getRetryCount() < getMaxAttempts();
        }
    }
}
