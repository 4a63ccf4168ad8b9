package me.golemcore.patches.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serializes tasks per key. A task submitted for a key starts only after the
 * previous task for that key finished, successfully or not. Keys do not block
 * each other beyond what the executor imposes.
 *
 * <p>
 * A task must never join another task of the same queue: with the single
 * {@code patch-queue} thread that is a deadlock. Follow-up work is submitted
 * instead and observed through {@link #drain(String)}.
 */
@Component
@Slf4j
public class SessionWriteQueue {

    private final Executor executor;
    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public SessionWriteQueue(@Qualifier("patchQueueExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(String key, Supplier<T> task) {
        @SuppressWarnings("unchecked")
        CompletableFuture<T>[] created = new CompletableFuture[1];
        tails.compute(key, (k, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            created[0] = previous
                    .handle((result, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), executor);
            return created[0];
        });
        CompletableFuture<T> next = created[0];
        next.whenComplete((result, error) -> {
            tails.remove(key, next);
            if (error != null) {
                log.debug("[Patches] Queued task for {} failed: {}", key, error.getMessage());
            }
        });
        return next;
    }

    /**
     * Completes once no task is queued or running for {@code key}, including
     * tasks submitted by tasks that were already queued.
     */
    public CompletableFuture<Void> drain(String key) {
        CompletableFuture<?> tail = tails.get(key);
        if (tail == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (tail.isDone()) {
            tails.remove(key, tail);
            return drain(key);
        }
        return tail.handle((result, error) -> null).thenCompose(ignored -> drain(key));
    }

    public boolean isIdle(String key) {
        CompletableFuture<?> tail = tails.get(key);
        return tail == null || tail.isDone();
    }
}
