/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.intervalframe.utils;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.intervalframe.utils.Preconditions.checkArgument;

/** Utils for thread pool. */
public class ThreadPoolUtils {

    /**
     * Create a thread pool with max thread number. Inactive threads will automatically exit.
     *
     * <p>The {@link ThreadPoolExecutor} is fixed-size, threads are started lazily and idle threads
     * are reclaimed after one minute.
     */
    public static ThreadPoolExecutor createCachedThreadPool(int threadNum, String namePrefix) {
        checkArgument(threadNum > 0, "Thread number must be positive, but is %s", threadNum);
        ThreadPoolExecutor executor =
                new ThreadPoolExecutor(
                        threadNum,
                        threadNum,
                        1,
                        TimeUnit.MINUTES,
                        new LinkedBlockingQueue<>(),
                        new ThreadFactoryBuilder()
                                .setDaemon(true)
                                .setNameFormat(namePrefix + "-%d")
                                .build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Applies {@code processor} to every input on the executor and returns the outputs
     * concatenated in input order, whatever order the tasks finish in.
     *
     * <p>A failure of any task is rethrown to the caller: unchecked exceptions as they are,
     * checked ones wrapped in a {@link RuntimeException}.
     */
    public static <T, U> List<T> randomlyExecuteSequentialReturn(
            ExecutorService executor, Function<U, List<T>> processor, List<U> input) {
        List<Future<List<T>>> futures = new ArrayList<>(input.size());
        for (U u : input) {
            futures.add(executor.submit(() -> processor.apply(u)));
        }

        List<T> result = new ArrayList<>();
        try {
            for (Future<List<T>> future : futures) {
                result.addAll(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for group results.", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        }
        return result;
    }

    private ThreadPoolUtils() {}
}
