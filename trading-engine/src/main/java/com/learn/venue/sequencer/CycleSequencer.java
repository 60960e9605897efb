package com.learn.venue.sequencer;

import com.learn.venue.ApiError;
import com.learn.venue.ApiException;
import com.learn.venue.support.LoggerSupport;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 串行执行撮合周期。
 * 所有周期按提交顺序在同一个线程上依次执行，某个周期抛出的异常只返回给它自己的调用方，
 * 不影响后续周期。
 */
@Component
public class CycleSequencer extends LoggerSupport {

    public static final String THREAD_NAME = "match-cycle";

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, THREAD_NAME);
        t.setDaemon(true);
        return t;
    });

    private volatile Thread cycleThread;

    public <T> T runExclusive(Supplier<T> cycle) {
        if(Thread.currentThread() == this.cycleThread) {
            // 已在撮合线程中，直接执行
            return cycle.get();
        }
        Callable<T> task = () -> {
            this.cycleThread = Thread.currentThread();
            return cycle.get();
        };
        Future<T> future;
        try {
            future = this.executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ApiException(ApiError.INTERNAL_SERVER_ERROR, null, "Sequencer is shut down.", e);
        }
        boolean interrupted = false;
        try {
            for(;;) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    // 周期已入队，必须等到执行结果
                    interrupted = true;
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if(cause instanceof RuntimeException re)
                throw re;
            if(cause instanceof Error err)
                throw err;
            throw new ApiException(ApiError.INTERNAL_SERVER_ERROR, null, cause.getMessage(), cause);
        } finally {
            if(interrupted)
                Thread.currentThread().interrupt();
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("shutdown {}...", THREAD_NAME);
        this.executor.shutdown();
        try {
            if(!this.executor.awaitTermination(10, TimeUnit.SECONDS))
                logger.warn("{} did not terminate in time.", THREAD_NAME);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{} was interrupted.", Thread.currentThread().getName());
        }
    }
}
