package me.golemcore.turns.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool running dispatched tool calls. Threads are daemons so a stuck
 * tool never keeps the JVM alive.
 */
@Configuration
@Slf4j
public class TurnDispatchConfiguration {

    private ExecutorService dispatchExecutor;

    @Bean
    public ExecutorService turnDispatchExecutor(TurnEngineProperties properties) {
        int poolSize = properties.getDispatch().getPoolSize();
        ThreadFactory threadFactory = daemonThreads("turn-dispatch");
        dispatchExecutor = poolSize > 0
                ? Executors.newFixedThreadPool(poolSize, threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
        log.debug("[Dispatch] executor ready (pool size {})", poolSize > 0 ? poolSize : "unbounded");
        return dispatchExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (dispatchExecutor != null) {
            dispatchExecutor.shutdownNow();
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
