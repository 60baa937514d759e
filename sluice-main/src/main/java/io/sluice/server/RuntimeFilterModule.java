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

import com.google.inject.Binder;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import io.airlift.units.Duration;
import io.sluice.execution.filter.RuntimeFilterBankManager;
import io.sluice.execution.filter.RuntimeFilterConfig;
import io.sluice.execution.filter.RuntimeFilterCoordinator;
import io.sluice.execution.filter.RuntimeFilterStats;
import io.sluice.memory.MemoryPool;
import io.sluice.memory.NodeMemoryConfig;

import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import static io.airlift.concurrent.Threads.daemonThreadsNamed;
import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.http.client.HttpClientBinder.httpClientBinder;
import static io.airlift.jaxrs.JaxrsBinder.jaxrsBinder;
import static io.airlift.json.JsonCodecBinder.jsonCodecBinder;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newFixedThreadPool;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.weakref.jmx.guice.ExportBinder.newExporter;

/**
 * Binds the runtime filter components of a node. Every node receives aggregated filters as a
 * worker and aggregates filter updates as a coordinator.
 */
public class RuntimeFilterModule
        implements Module
{
    public static final String GENERAL_POOL = "general";

    @Override
    public void configure(Binder binder)
    {
        configBinder(binder).bindConfig(RuntimeFilterConfig.class);
        configBinder(binder).bindConfig(NodeMemoryConfig.class);
        newExporter(binder).export(MemoryPool.class).withGeneratedName();

        // transport
        jsonCodecBinder(binder).bindJsonCodec(FilterUpdateRequest.class);
        jsonCodecBinder(binder).bindJsonCodec(PublishFilterRequest.class);
        httpClientBinder(binder).bindHttpClient("runtime-filter", ForRuntimeFilter.class)
                .withConfigDefaults(config -> {
                    config.setIdleTimeout(new Duration(30, SECONDS));
                    config.setRequestTimeout(new Duration(10, SECONDS));
                });
        binder.bind(HttpRuntimeFilterClient.class).in(Scopes.SINGLETON);
        binder.bind(FilterUpdateClient.class).to(HttpRuntimeFilterClient.class);
        binder.bind(FilterPublishClient.class).to(HttpRuntimeFilterClient.class);
        binder.bind(FilterUpdateDispatcher.class).in(Scopes.SINGLETON);

        // worker
        binder.bind(RuntimeFilterStats.class).in(Scopes.SINGLETON);
        binder.bind(RuntimeFilterBankManager.class).in(Scopes.SINGLETON);
        newExporter(binder).export(RuntimeFilterBankManager.class).withGeneratedName();
        jaxrsBinder(binder).bind(RuntimeFilterResource.class);

        // coordinator
        binder.bind(Executor.class).annotatedWith(ForRuntimeFilter.class).to(Key.get(ExecutorService.class, ForRuntimeFilter.class));
        binder.bind(ExecutorCleanup.class).in(Scopes.SINGLETON);
        binder.bind(RuntimeFilterCoordinator.class).in(Scopes.SINGLETON);
        newExporter(binder).export(RuntimeFilterCoordinator.class).withGeneratedName();
        jaxrsBinder(binder).bind(CoordinatorRuntimeFilterResource.class);
    }

    @Provides
    @Singleton
    public static MemoryPool createMemoryPool(NodeMemoryConfig config)
    {
        return new MemoryPool(GENERAL_POOL, config.getMaxQueryMemoryPerNode());
    }

    @Provides
    @Singleton
    @ForRuntimeFilter
    public static ExecutorService createPublishExecutor(RuntimeFilterConfig config)
    {
        return newFixedThreadPool(config.getDispatcherThreads(), daemonThreadsNamed("runtime-filter-publisher-%s"));
    }

    public static class ExecutorCleanup
    {
        private final ExecutorService publishExecutor;

        @Inject
        public ExecutorCleanup(@ForRuntimeFilter ExecutorService publishExecutor)
        {
            this.publishExecutor = requireNonNull(publishExecutor, "publishExecutor is null");
        }

        @PreDestroy
        public void shutdown()
        {
            publishExecutor.shutdownNow();
        }
    }
}
