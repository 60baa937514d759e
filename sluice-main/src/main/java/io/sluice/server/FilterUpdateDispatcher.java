/*
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
 */
package io.sluice.server;

import io.airlift.log.Logger;
import io.sluice.execution.filter.RuntimeFilterConfig;
import io.sluice.execution.filter.RuntimeFilterStats;

import javax.annotation.PreDestroy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.net.URI;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

import static io.airlift.concurrent.Threads.daemonThreadsNamed;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Sends filter updates to the coordinator in the background. A lost update only means the
 * filter never arrives at its consumers, so failures are logged and counted, never retried or
 * reported to the caller.
 */
@ThreadSafe
public class FilterUpdateDispatcher
{
    private static final Logger log = Logger.get(FilterUpdateDispatcher.class);

    private final FilterUpdateClient client;
    private final ExecutorService executor;
    private final RuntimeFilterStats stats;

    @Inject
    public FilterUpdateDispatcher(FilterUpdateClient client, RuntimeFilterConfig config, RuntimeFilterStats stats)
    {
        this(client,
                new ThreadPoolExecutor(
                        config.getDispatcherThreads(),
                        config.getDispatcherThreads(),
                        0L,
                        MILLISECONDS,
                        new ArrayBlockingQueue<>(config.getDispatcherQueueSize()),
                        daemonThreadsNamed("runtime-filter-dispatcher-%s")),
                stats);
    }

    public FilterUpdateDispatcher(FilterUpdateClient client, ExecutorService executor, RuntimeFilterStats stats)
    {
        this.client = requireNonNull(client, "client is null");
        this.executor = requireNonNull(executor, "executor is null");
        this.stats = requireNonNull(stats, "stats is null");
    }

    @PreDestroy
    public void stop()
    {
        executor.shutdownNow();
    }

    public void submit(URI coordinatorLocation, FilterUpdateRequest request)
    {
        requireNonNull(coordinatorLocation, "coordinatorLocation is null");
        requireNonNull(request, "request is null");
        try {
            executor.execute(() -> send(coordinatorLocation, request));
        }
        catch (RejectedExecutionException e) {
            log.warn("Dropping update for filter %s of query %s: dispatcher is saturated or stopped", request.getFilterId(), request.getQueryId());
            stats.dispatchFailed();
        }
    }

    private void send(URI coordinatorLocation, FilterUpdateRequest request)
    {
        try {
            client.sendFilterUpdate(coordinatorLocation, request);
            stats.updateDispatched();
        }
        catch (RuntimeException e) {
            log.info("Couldn't send filter %s of query %s to coordinator %s: %s", request.getFilterId(), request.getQueryId(), coordinatorLocation, e.getMessage());
            stats.dispatchFailed();
        }
    }
}
