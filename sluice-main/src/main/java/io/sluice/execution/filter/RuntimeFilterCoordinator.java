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

import com.google.common.collect.ImmutableSet;
import io.airlift.log.Logger;
import io.sluice.common.QueryId;
import io.sluice.common.filter.BloomFilter;
import io.sluice.common.filter.SerializedBloomFilter;
import io.sluice.server.FilterPublishClient;
import io.sluice.server.FilterUpdateRequest;
import io.sluice.server.ForRuntimeFilter;
import io.sluice.server.PublishFilterRequest;
import org.weakref.jmx.Managed;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Coordinator side aggregation of runtime filters. Filters built by the fragment instances of
 * a query are OR-merged, and once every producer has reported, the merged filter is pushed to
 * every worker that consumes it.
 * <p>
 * A producer that gave up on its filter (always true), a malformed filter or filters of
 * different sizes make the merged filter useless. It is then replaced by the always true
 * filter, which is published right away so consumers stop waiting, and later updates are ignored.
 */
@ThreadSafe
public class RuntimeFilterCoordinator
{
    private static final Logger log = Logger.get(RuntimeFilterCoordinator.class);

    private final FilterPublishClient publishClient;
    private final Executor publishExecutor;
    private final Map<QueryId, Map<Integer, AggregatedFilter>> queries = new ConcurrentHashMap<>();

    @Inject
    public RuntimeFilterCoordinator(FilterPublishClient publishClient, @ForRuntimeFilter Executor publishExecutor)
    {
        this.publishClient = requireNonNull(publishClient, "publishClient is null");
        this.publishExecutor = requireNonNull(publishExecutor, "publishExecutor is null");
    }

    public void registerFilter(QueryId queryId, int filterId, int producerCount, Set<URI> consumerLocations)
    {
        requireNonNull(queryId, "queryId is null");
        requireNonNull(consumerLocations, "consumerLocations is null");
        checkArgument(producerCount > 0, "producerCount must be positive: %s", producerCount);

        AggregatedFilter filter = new AggregatedFilter(queryId, filterId, producerCount, consumerLocations);
        queries.compute(queryId, (id, filters) -> {
            Map<Integer, AggregatedFilter> queryFilters = filters == null ? new ConcurrentHashMap<>() : filters;
            checkState(!queryFilters.containsKey(filterId), "Filter %s of query %s is already registered", filterId, queryId);
            queryFilters.put(filterId, filter);
            return queryFilters;
        });
    }

    public void updateFilter(FilterUpdateRequest request)
    {
        requireNonNull(request, "request is null");
        Map<Integer, AggregatedFilter> filters = queries.get(request.getQueryId());
        AggregatedFilter filter = filters == null ? null : filters.get(request.getFilterId());
        if (filter == null) {
            // the query may already be gone
            log.debug("Ignoring update for unknown filter %s of query %s", request.getFilterId(), request.getQueryId());
            return;
        }
        Optional<PublishFilterRequest> publishRequest = filter.add(request.getBloomFilter());
        if (publishRequest.isPresent()) {
            publish(request.getQueryId(), filter.getConsumerLocations(), publishRequest.get());
            removeQueryIfComplete(request.getQueryId());
        }
    }

    public void removeQuery(QueryId queryId)
    {
        queries.remove(requireNonNull(queryId, "queryId is null"));
    }

    // late updates for a released query are ignored like updates for a published filter
    private void removeQueryIfComplete(QueryId queryId)
    {
        queries.computeIfPresent(queryId, (id, filters) -> {
            if (filters.values().stream().allMatch(AggregatedFilter::isPublished)) {
                log.debug("All runtime filters of query %s are published", queryId);
                return null;
            }
            return filters;
        });
    }

    @Managed
    public int getActiveQueryCount()
    {
        return queries.size();
    }

    private void publish(QueryId queryId, Set<URI> consumerLocations, PublishFilterRequest request)
    {
        for (URI location : consumerLocations) {
            try {
                publishExecutor.execute(() -> publishTo(location, queryId, request));
            }
            catch (RejectedExecutionException e) {
                log.warn("Could not schedule publish of filter %s of query %s to %s", request.getFilterId(), queryId, location);
            }
        }
    }

    private void publishTo(URI location, QueryId queryId, PublishFilterRequest request)
    {
        try {
            publishClient.publishFilter(location, queryId, request);
        }
        catch (RuntimeException e) {
            log.warn(e, "Failed to publish filter %s of query %s to %s", request.getFilterId(), queryId, location);
        }
    }

    @ThreadSafe
    private static class AggregatedFilter
    {
        private final QueryId queryId;
        private final int filterId;
        private final Set<URI> consumerLocations;

        @GuardedBy("this")
        private int pendingProducers;
        @GuardedBy("this")
        private BloomFilter mergedFilter;
        @GuardedBy("this")
        private boolean published;

        private AggregatedFilter(QueryId queryId, int filterId, int producerCount, Set<URI> consumerLocations)
        {
            this.queryId = queryId;
            this.filterId = filterId;
            this.pendingProducers = producerCount;
            this.consumerLocations = ImmutableSet.copyOf(consumerLocations);
        }

        public Set<URI> getConsumerLocations()
        {
            return consumerLocations;
        }

        public synchronized boolean isPublished()
        {
            return published;
        }

        /**
         * @return the filter to publish, once it is known
         */
        public synchronized Optional<PublishFilterRequest> add(SerializedBloomFilter serializedFilter)
        {
            if (published) {
                return Optional.empty();
            }
            pendingProducers--;

            if (serializedFilter.isAlwaysTrue()) {
                return disable();
            }

            BloomFilter bloomFilter;
            try {
                bloomFilter = BloomFilter.deserialize(serializedFilter);
            }
            catch (IllegalArgumentException e) {
                log.warn(e, "Received malformed filter %s of query %s", filterId, queryId);
                return disable();
            }

            if (mergedFilter == null) {
                mergedFilter = bloomFilter;
            }
            else if (mergedFilter.getLogHeapSpace() != bloomFilter.getLogHeapSpace()) {
                log.warn("Filter %s of query %s has inconsistent sizes: %s and %s", filterId, queryId, mergedFilter.getLogHeapSpace(), bloomFilter.getLogHeapSpace());
                return disable();
            }
            else {
                mergedFilter.merge(bloomFilter);
            }

            if (pendingProducers > 0) {
                return Optional.empty();
            }
            published = true;
            PublishFilterRequest request = new PublishFilterRequest(filterId, mergedFilter.serialize());
            mergedFilter = null;
            return Optional.of(request);
        }

        @GuardedBy("this")
        private Optional<PublishFilterRequest> disable()
        {
            published = true;
            mergedFilter = null;
            return Optional.of(new PublishFilterRequest(filterId, SerializedBloomFilter.alwaysTrue()));
        }
    }
}
