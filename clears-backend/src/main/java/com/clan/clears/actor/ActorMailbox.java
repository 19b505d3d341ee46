package com.clan.clears.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 单个 actor 的串行邮箱：任务按提交顺序逐个执行，线程由共享线程池分配。
 * 某个任务失败不会阻塞排在它后面的任务。
 */
public class ActorMailbox {

    private static final Logger log = LoggerFactory.getLogger(ActorMailbox.class);

    private final String actorKey;
    private final Executor executor;
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    public ActorMailbox(String actorKey, Executor executor) {
        this.actorKey = actorKey;
        this.executor = executor;
    }

    public synchronized <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> next = tail
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.debug("邮箱 {} 的上一个任务失败，继续执行后续任务: {}", actorKey, error.getMessage());
                    }
                    return null;
                })
                .thenApplyAsync(ignored -> invoke(task), executor);
        tail = next;
        return next;
    }

    /**
     * 提交并等待结果，任务自身抛出的运行时异常原样抛出。
     */
    public <T> T call(Callable<T> task) {
        try {
            return submit(task).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
