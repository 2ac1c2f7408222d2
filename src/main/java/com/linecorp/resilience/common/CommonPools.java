/*
 * Copyright 2016 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.resilience.common;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import io.netty.util.concurrent.DefaultThreadFactory;

/**
 * Provides the thread pools shared by circuit breakers and clients.
 */
public final class CommonPools {

    private static final int MAX_BLOCKING_TASK_THREADS = 200;

    private static final ExecutorService BLOCKING_TASK_EXECUTOR;

    static {
        final ThreadPoolExecutor executor = new ThreadPoolExecutor(
                MAX_BLOCKING_TASK_THREADS, MAX_BLOCKING_TASK_THREADS,
                60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                new DefaultThreadFactory("resilience-blocking-tasks", true));
        executor.allowCoreThreadTimeOut(true);
        BLOCKING_TASK_EXECUTOR = executor;
    }

    /**
     * Returns the default {@link ExecutorService} which runs guarded operations that may block,
     * such as calls bounded by a timeout and asynchronous executions.
     * Its threads are daemon threads and time out after 60 seconds of idleness.
     */
    public static ExecutorService blockingTaskExecutor() {
        return BLOCKING_TASK_EXECUTOR;
    }

    private CommonPools() {}
}
