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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import io.airlift.log.Logger;
import io.airlift.units.DataSize;
import io.sluice.common.QueryId;
import io.sluice.common.filter.BloomFilter;
import io.sluice.common.filter.SerializedBloomFilter;
import io.sluice.memory.QueryMemoryTracker;
import io.sluice.server.FilterUpdateDispatcher;
import io.sluice.server.FilterUpdateRequest;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.sluice.common.filter.BloomFilter.ALWAYS_TRUE_FILTER;
import static io.sluice.common.filter.BloomFilter.MAX_LOG_HEAP_SPACE;
import static io.sluice.common.filter.BloomFilter.getExpectedHeapSpaceUsed;
import static io.sluice.execution.filter.RuntimeFilterMode.GLOBAL;
import static io.sluice.execution.filter.RuntimeFilterMode.OFF;
import static java.math.RoundingMode.CEILING;
import static java.util.Objects.requireNonNull;

/**
 * Owns the runtime filters of one query on one node, both the filters built here and the
 * filters that scan operators here wait for, together with the bloom filter memory they use.
 * <p>
 * All bloom filters of a query share one capacity, so filters built by different fragment
 * instances can be merged. Memory for them is reserved from the query's tracker up front and
 * released in one step when the bank is closed. Running out of memory never fails the query:
 * a scratch filter is simply not handed out, and a global filter is replaced by the always
 * true filter.
 */
@ThreadSafe
public class RuntimeFilterBank
        implements AutoCloseable
{
    private static final Logger log = Logger.get(RuntimeFilterBank.class);

    private final QueryId queryId;
    private final RuntimeFilterOptions options;
    private final double maxErrorRate;
    private final URI coordinatorLocation;
    private final QueryMemoryTracker memoryTracker;
    private final FilterUpdateDispatcher dispatcher;
    private final RuntimeFilterStats stats;
    private final Ticker ticker;
    private final int logFilterSize;

    @GuardedBy("this")
    private final Map<Integer, RuntimeFilter> producedFilters = new HashMap<>();
    @GuardedBy("this")
    private final Map<Integer, RuntimeFilter> consumedFilters = new HashMap<>();
    @GuardedBy("this")
    private final List<BloomFilter> bloomFilters = new ArrayList<>();
    @GuardedBy("this")
    private long allocatedBytes;
    @GuardedBy("this")
    private boolean closed;

    public RuntimeFilterBank(
            QueryId queryId,
            RuntimeFilterOptions options,
            RuntimeFilterConfig config,
            URI coordinatorLocation,
            QueryMemoryTracker memoryTracker,
            FilterUpdateDispatcher dispatcher,
            RuntimeFilterStats stats,
            Ticker ticker)
    {
        this.queryId = requireNonNull(queryId, "queryId is null");
        this.options = requireNonNull(options, "options is null");
        requireNonNull(config, "config is null");
        this.maxErrorRate = config.getMaxErrorRate();
        this.coordinatorLocation = requireNonNull(coordinatorLocation, "coordinatorLocation is null");
        this.memoryTracker = requireNonNull(memoryTracker, "memoryTracker is null");
        this.dispatcher = requireNonNull(dispatcher, "dispatcher is null");
        this.stats = requireNonNull(stats, "stats is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
        this.logFilterSize = computeLogFilterSize(options.getFilterSize(), config.getMinFilterSize(), config.getMaxFilterSize());
    }

    /**
     * Clamps the requested filter size into {@code [minFilterSize, maxFilterSize]} and returns the
     * base-2 logarithm of the clamped size, rounded up.
     */
    @VisibleForTesting
    static int computeLogFilterSize(DataSize filterSize, DataSize minFilterSize, DataSize maxFilterSize)
    {
        long minBytes = minFilterSize.toBytes();
        long maxBytes = maxFilterSize.toBytes();
        checkArgument(minBytes > 0, "minFilterSize must be positive");
        checkArgument(minBytes <= maxBytes, "minFilterSize %s is larger than maxFilterSize %s", minFilterSize, maxFilterSize);

        long bytes = Math.min(Math.max(filterSize.toBytes(), minBytes), maxBytes);
        int logFilterSize = LongMath.log2(bytes, CEILING);
        checkArgument(logFilterSize <= MAX_LOG_HEAP_SPACE, "filter size %s exceeds the largest bloom filter", filterSize);
        return logFilterSize;
    }

    public QueryId getQueryId()
    {
        return queryId;
    }

    public RuntimeFilterOptions getOptions()
    {
        return options;
    }

    public int getLogFilterSize()
    {
        return logFilterSize;
    }

    public synchronized RuntimeFilter registerFilter(RuntimeFilterDescriptor descriptor, boolean isProducer)
    {
        requireNonNull(descriptor, "descriptor is null");
        checkState(!closed, "Runtime filter bank for query %s is closed", queryId);

        Map<Integer, RuntimeFilter> filters = isProducer ? producedFilters : consumedFilters;
        int filterId = descriptor.getFilterId();
        checkState(!filters.containsKey(filterId), "Filter %s is already registered as a %s", filterId, isProducer ? "producer" : "consumer");

        RuntimeFilter filter = new RuntimeFilter(descriptor, options.getWaitTime(), ticker);
        filters.put(filterId, filter);
        return filter;
    }

    /**
     * Returns an empty bloom filter of this query's capacity for a build side operator to fill,
     * or empty if the bank is closed or the query memory budget cannot hold another filter. In
     * the latter case the operator should not build the filter.
     */
    public synchronized Optional<BloomFilter> allocateScratchBloomFilter()
    {
        if (closed) {
            return Optional.empty();
        }

        long requiredBytes = getExpectedHeapSpaceUsed(logFilterSize);
        if (!memoryTracker.tryConsume(requiredBytes)) {
            stats.scratchAllocationRejected();
            return Optional.empty();
        }

        BloomFilter bloomFilter = new BloomFilter(logFilterSize);
        checkState(bloomFilter.getHeapSpaceUsed() == requiredBytes, "Bloom filter uses %s bytes, but %s bytes were reserved", bloomFilter.getHeapSpaceUsed(), requiredBytes);
        allocatedBytes += requiredBytes;
        bloomFilters.add(bloomFilter);
        stats.scratchFilterAllocated(requiredBytes);
        return Optional.of(bloomFilter);
    }

    /**
     * Hands a completed bloom filter built on this node to its consumers. A filter whose only
     * consumer runs on this node is delivered directly; otherwise, in global mode, it is sent to
     * the coordinator for aggregation. Sending happens in the background and never blocks the caller.
     * The filter must not be modified after this call.
     */
    public void updateFilterFromLocal(int filterId, BloomFilter bloomFilter)
    {
        requireNonNull(bloomFilter, "bloomFilter is null");
        checkState(options.getMode() != OFF, "Runtime filters are disabled for query %s", queryId);

        synchronized (this) {
            if (closed) {
                return;
            }
            RuntimeFilter producer = producedFilters.get(filterId);
            checkState(producer != null, "Filter %s is not registered as a producer", filterId);
            producer.setBloomFilter(bloomFilter);

            if (producer.getDescriptor().hasLocalTarget()) {
                RuntimeFilter consumer = consumedFilters.get(filterId);
                if (consumer != null && !consumer.hasBloomFilter()) {
                    consumer.setBloomFilter(bloomFilter);
                    recordArrival(consumer);
                }
                return;
            }
            if (options.getMode() != GLOBAL) {
                return;
            }
        }

        dispatcher.submit(coordinatorLocation, new FilterUpdateRequest(queryId, filterId, bloomFilter.serialize()));
    }

    /**
     * Installs the aggregated filter pushed by the coordinator. Does nothing once the bank is closed.
     */
    public synchronized void publishGlobalFilter(int filterId, SerializedBloomFilter serializedFilter)
    {
        requireNonNull(serializedFilter, "serializedFilter is null");
        if (closed) {
            return;
        }
        RuntimeFilter consumer = consumedFilters.get(filterId);
        checkState(consumer != null, "Filter %s is not registered as a consumer", filterId);
        checkState(!consumer.hasBloomFilter(), "Filter %s has already arrived", filterId);

        consumer.setBloomFilter(materializeGlobalFilter(filterId, serializedFilter));
        recordArrival(consumer);
    }

    @GuardedBy("this")
    private BloomFilter materializeGlobalFilter(int filterId, SerializedBloomFilter serializedFilter)
    {
        if (serializedFilter.isAlwaysTrue()) {
            return ALWAYS_TRUE_FILTER;
        }
        if (serializedFilter.getLogHeapSpace() > MAX_LOG_HEAP_SPACE) {
            log.warn("Query %s: filter %s has invalid capacity %s, using always true filter", queryId, filterId, serializedFilter.getLogHeapSpace());
            stats.alwaysTrueFallback();
            return ALWAYS_TRUE_FILTER;
        }

        long requiredBytes = getExpectedHeapSpaceUsed(serializedFilter.getLogHeapSpace());
        if (!memoryTracker.tryConsume(requiredBytes)) {
            log.debug("Query %s: not enough memory for filter %s (%s bytes), using always true filter", queryId, filterId, requiredBytes);
            stats.alwaysTrueFallback();
            return ALWAYS_TRUE_FILTER;
        }

        BloomFilter bloomFilter;
        try {
            bloomFilter = BloomFilter.deserialize(serializedFilter);
        }
        catch (IllegalArgumentException e) {
            memoryTracker.release(requiredBytes);
            log.warn(e, "Query %s: received malformed filter %s, using always true filter", queryId, filterId);
            stats.alwaysTrueFallback();
            return ALWAYS_TRUE_FILTER;
        }

        checkState(bloomFilter.getHeapSpaceUsed() == requiredBytes, "Bloom filter uses %s bytes, but %s bytes were reserved", bloomFilter.getHeapSpaceUsed(), requiredBytes);
        allocatedBytes += requiredBytes;
        bloomFilters.add(bloomFilter);
        stats.globalFilterAllocated(requiredBytes);
        return bloomFilter;
    }

    @GuardedBy("this")
    private void recordArrival(RuntimeFilter filter)
    {
        filter.getArrivalDelay().ifPresent(delay -> {
            stats.filterArrived(delay);
            log.debug("Query %s: filter %s arrived after %s", queryId, filter.getFilterId(), delay);
        });
    }

    /**
     * Whether a filter of this query's capacity holding {@code maxNdv} distinct keys would have a
     * false positive probability above the configured maximum error rate. A negative
     * {@code maxNdv} means the number of distinct keys is unknown, and the filter is disabled.
     */
    public boolean shouldDisableFilter(long maxNdv)
    {
        if (maxNdv < 0) {
            return true;
        }
        return BloomFilter.falsePositiveProbability(maxNdv, logFilterSize) > maxErrorRate;
    }

    public synchronized long getAllocatedBytes()
    {
        return allocatedBytes;
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }

    /**
     * Drops every filter owned by this bank and returns all bloom filter memory to the query
     * tracker. Later calls are ignored.
     */
    @Override
    public synchronized void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        producedFilters.clear();
        consumedFilters.clear();
        bloomFilters.clear();
        memoryTracker.release(allocatedBytes);
    }

    @Override
    public synchronized String toString()
    {
        return toStringHelper(this)
                .add("queryId", queryId)
                .add("mode", options.getMode())
                .add("logFilterSize", logFilterSize)
                .add("producedFilters", producedFilters.size())
                .add("consumedFilters", consumedFilters.size())
                .add("allocatedBytes", allocatedBytes)
                .add("closed", closed)
                .toString();
    }
}
