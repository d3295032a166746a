package me.golemcore.tunebot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.Operation;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs each {@link Operation} as one task on a bounded worker pool. Once
 * {@code bot.operations.timeout} passes the operation is marked cancelled; the
 * task itself is never interrupted and is expected to notice the flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationRunner {

    private static final int TERMINATION_TIMEOUT_SECONDS = 5;

    private final BotProperties properties;

    private ExecutorService workers;
    private ScheduledExecutorService deadlines;

    @PostConstruct
    void init() {
        int threads = Math.max(1, properties.getOperations().getThreads());
        workers = Executors.newFixedThreadPool(threads, namedDaemon("tunebot-op-"));
        deadlines = Executors.newSingleThreadScheduledExecutor(namedDaemon("tunebot-deadline-"));
        log.info("Operation pool started with {} worker(s)", threads);
    }

    @PreDestroy
    void destroy() {
        workers.shutdownNow();
        deadlines.shutdownNow();
        try {
            workers.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public <T> CompletableFuture<T> submit(Operation operation, Supplier<T> task) {
        Duration timeout = properties.getOperations().getTimeout();
        ScheduledFuture<?> deadline = deadlines.schedule(() -> {
            log.warn("[Operation] {} ({}) exceeded {}s, marking cancelled",
                    operation.getToken(), operation.getCommand(), timeout.toSeconds());
            operation.cancel();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        return CompletableFuture.supplyAsync(task, workers)
                .whenComplete((result, error) -> deadline.cancel(false));
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
