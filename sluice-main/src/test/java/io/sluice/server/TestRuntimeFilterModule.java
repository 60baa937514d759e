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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Injector;
import com.google.inject.Key;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.airlift.json.JsonModule;
import io.airlift.units.Duration;
import io.sluice.common.QueryId;
import io.sluice.common.filter.SerializedBloomFilter;
import io.sluice.execution.filter.RuntimeFilter;
import io.sluice.execution.filter.RuntimeFilterBank;
import io.sluice.execution.filter.RuntimeFilterBankManager;
import io.sluice.execution.filter.RuntimeFilterConfig;
import io.sluice.execution.filter.RuntimeFilterCoordinator;
import io.sluice.execution.filter.RuntimeFilterDescriptor;
import io.sluice.memory.MemoryPool;
import org.testng.annotations.Test;
import org.weakref.jmx.guice.MBeanModule;
import org.weakref.jmx.testing.TestingMBeanServer;

import javax.management.MBeanServer;
import javax.management.ObjectName;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static io.sluice.execution.filter.RuntimeFilterMode.LOCAL;
import static io.sluice.server.RuntimeFilterModule.GENERAL_POOL;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestRuntimeFilterModule
{
    private static final QueryId QUERY_ID = new QueryId("query");
    private static final URI COORDINATOR = URI.create("http://coordinator:8080");

    @Test
    public void testWiring()
            throws Exception
    {
        MBeanServer mbeanServer = new TestingMBeanServer();
        Bootstrap app = new Bootstrap(
                new JsonModule(),
                new MBeanModule(),
                binder -> binder.bind(MBeanServer.class).toInstance(mbeanServer),
                new RuntimeFilterModule());

        Injector injector = app
                .doNotInitializeLogging()
                .setRequiredConfigurationProperties(ImmutableMap.<String, String>builder()
                        .put("runtime-filter.mode", "LOCAL")
                        .put("runtime-filter.filter-size", "64kB")
                        .put("runtime-filter.wait-time", "250ms")
                        .put("runtime-filter.dispatcher-threads", "2")
                        .put("query.max-memory-per-node", "1MB")
                        .build())
                .initialize();
        LifeCycleManager lifeCycleManager = injector.getInstance(LifeCycleManager.class);

        MemoryPool memoryPool = injector.getInstance(MemoryPool.class);
        ExecutorService publishExecutor = injector.getInstance(Key.get(ExecutorService.class, ForRuntimeFilter.class));
        RuntimeFilterBank bank;
        try {
            RuntimeFilterConfig config = injector.getInstance(RuntimeFilterConfig.class);
            assertEquals(config.getMode(), LOCAL);
            assertEquals(config.getWaitTime(), new Duration(250, MILLISECONDS));
            assertEquals(config.getDispatcherThreads(), 2);

            assertEquals(memoryPool.getId(), GENERAL_POOL);
            assertEquals(memoryPool.getMaxBytes(), 1024 * 1024);

            assertSame(injector.getInstance(FilterUpdateClient.class), injector.getInstance(HttpRuntimeFilterClient.class));
            assertSame(injector.getInstance(FilterPublishClient.class), injector.getInstance(HttpRuntimeFilterClient.class));

            RuntimeFilterBankManager bankManager = injector.getInstance(RuntimeFilterBankManager.class);
            bank = bankManager.createBank(QUERY_ID, COORDINATOR, Optional.empty());
            assertEquals(bank.getOptions().getMode(), LOCAL);
            assertEquals(bank.getLogFilterSize(), 16);
            RuntimeFilter consumer = bank.registerFilter(new RuntimeFilterDescriptor(1, false), false);
            assertEquals(consumer.getWaitTime(), new Duration(250, MILLISECONDS));
            assertTrue(bank.allocateScratchBloomFilter().isPresent());
            assertEquals(memoryPool.getReservedBytes(), 64 * 1024);

            // the worker endpoint reaches the bank of the query
            injector.getInstance(RuntimeFilterResource.class)
                    .publishFilter(QUERY_ID, new PublishFilterRequest(1, SerializedBloomFilter.alwaysTrue()));
            assertTrue(consumer.isAlwaysTrue());

            RuntimeFilterCoordinator coordinator = injector.getInstance(RuntimeFilterCoordinator.class);
            coordinator.registerFilter(QUERY_ID, 1, 2, ImmutableSet.of(COORDINATOR));
            assertEquals(coordinator.getActiveQueryCount(), 1);
            injector.getInstance(CoordinatorRuntimeFilterResource.class).removeQuery(QUERY_ID);
            assertEquals(coordinator.getActiveQueryCount(), 0);

            assertTrue(mbeanServer.isRegistered(new ObjectName("io.sluice.execution.filter:name=RuntimeFilterBankManager")));
            assertTrue(mbeanServer.isRegistered(new ObjectName("io.sluice.execution.filter:name=RuntimeFilterCoordinator")));
            assertTrue(mbeanServer.isRegistered(new ObjectName("io.sluice.memory:name=MemoryPool")));
            assertFalse(publishExecutor.isShutdown());
        }
        finally {
            lifeCycleManager.stop();
        }

        // stopping the node closes every bank and its executors
        assertTrue(bank.isClosed());
        assertEquals(memoryPool.getReservedBytes(), 0);
        assertTrue(publishExecutor.isShutdown());
    }
}
