package com.example.comicshelf.common.config;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private final List<ExecutorService> executors = new ArrayList<>();

    /**
     * Runs whole scan jobs. One at a time; the queue only absorbs a start racing a finish.
     */
    @Bean
    public ExecutorService scanJobExecutor() {
        ExecutorService executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2),
                new NamedThreadFactory("scan-job-"),
                new ThreadPoolExecutor.AbortPolicy());
        executors.add(executor);
        return executor;
    }

    @Bean
    public ExecutorService comicProcessingExecutor(AppScanProperties appScanProperties) {
        int workers = Math.max(1, appScanProperties.getWorkerThreads());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("comic-worker-"));
        executors.add(executor);
        return executor;
    }

    @Bean
    public ExecutorService coverThumbnailExecutor(AppThumbnailProperties appThumbnailProperties) {
        int threads = Math.max(1, appThumbnailProperties.getOnDemandThreads());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory("cover-ondemand-"));
        executors.add(executor);
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
    }

    public static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
