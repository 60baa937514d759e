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
package io.sluice.execution.filter;

import com.google.common.base.Ticker;
import io.airlift.log.Logger;
import io.airlift.units.DataSize;
import io.sluice.common.QueryId;
import io.sluice.memory.MemoryPool;
import io.sluice.memory.QueryMemoryTracker;
import io.sluice.server.FilterUpdateDispatcher;
import io.sluice.server.PublishFilterRequest;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

import javax.annotation.PreDestroy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * The runtime filter banks of the queries running on this worker.
 */
@ThreadSafe
public class RuntimeFilterBankManager
{
    private static final Logger log = Logger.get(RuntimeFilterBankManager.class);

    static final String ALLOCATION_TAG = "RuntimeFilterBank";

    private final RuntimeFilterConfig config;
    private final MemoryPool memoryPool;
    private final FilterUpdateDispatcher dispatcher;
    private final RuntimeFilterStats stats;
    private final Ticker ticker;
    private final Map<QueryId, RuntimeFilterBank> banks = new ConcurrentHashMap<>();

    @Inject
    public RuntimeFilterBankManager(
            RuntimeFilterConfig config,
            MemoryPool memoryPool,
            FilterUpdateDispatcher dispatcher,
            RuntimeFilterStats stats)
    {
        this(config, memoryPool, dispatcher, stats, Ticker.systemTicker());
    }

    public RuntimeFilterBankManager(
            RuntimeFilterConfig config,
            MemoryPool memoryPool,
            FilterUpdateDispatcher dispatcher,
            RuntimeFilterStats stats,
            Ticker ticker)
    {
        this.config = requireNonNull(config, "config is null");
        this.memoryPool = requireNonNull(memoryPool, "memoryPool is null");
        this.dispatcher = requireNonNull(dispatcher, "dispatcher is null");
        this.stats = requireNonNull(stats, "stats is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
    }

    public RuntimeFilterBank createBank(QueryId queryId, URI coordinatorLocation, Optional<DataSize> maxQueryMemory)
    {
        return createBank(queryId, RuntimeFilterOptions.fromConfig(config), coordinatorLocation, maxQueryMemory);
    }

    public RuntimeFilterBank createBank(QueryId queryId, RuntimeFilterOptions options, URI coordinatorLocation, Optional<DataSize> maxQueryMemory)
    {
        requireNonNull(queryId, "queryId is null");
        QueryMemoryTracker memoryTracker = new QueryMemoryTracker(queryId, ALLOCATION_TAG, memoryPool, maxQueryMemory);
        RuntimeFilterBank bank = new RuntimeFilterBank(queryId, options, config, coordinatorLocation, memoryTracker, dispatcher, stats, ticker);
        RuntimeFilterBank existing = banks.putIfAbsent(queryId, bank);
        checkState(existing == null, "Runtime filter bank for query %s already exists", queryId);
        return bank;
    }

    public Optional<RuntimeFilterBank> getBank(QueryId queryId)
    {
        return Optional.ofNullable(banks.get(requireNonNull(queryId, "queryId is null")));
    }

    /**
     * @return false if no bank exists for the query, for example because it already finished
     */
    public boolean publishGlobalFilter(QueryId queryId, PublishFilterRequest request)
    {
        requireNonNull(request, "request is null");
        Optional<RuntimeFilterBank> bank = getBank(queryId);
        if (!bank.isPresent()) {
            log.debug("Ignoring filter %s for unknown query %s", request.getFilterId(), queryId);
            return false;
        }
        bank.get().publishGlobalFilter(request.getFilterId(), request.getBloomFilter());
        return true;
    }

    public void removeBank(QueryId queryId)
    {
        RuntimeFilterBank bank = banks.remove(requireNonNull(queryId, "queryId is null"));
        if (bank != null) {
            bank.close();
        }
    }

    @PreDestroy
    public void stop()
    {
        for (QueryId queryId : banks.keySet()) {
            removeBank(queryId);
        }
    }

    @Managed
    public int getActiveBanks()
    {
        return banks.size();
    }

    @Managed
    @Nested
    public RuntimeFilterStats getStats()
    {
        return stats;
    }
}
