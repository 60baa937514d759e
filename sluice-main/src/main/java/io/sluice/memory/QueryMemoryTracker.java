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
package io.sluice.memory;

import io.airlift.units.DataSize;
import io.sluice.common.QueryId;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The memory budget of one query component. Every request either reserves all of the requested
 * bytes in the shared pool or none of them, and never blocks.
 */
@ThreadSafe
public class QueryMemoryTracker
{
    private final QueryId queryId;
    private final String allocationTag;
    private final MemoryPool memoryPool;
    private final long maxBytes;

    @GuardedBy("this")
    private long consumedBytes;

    public QueryMemoryTracker(QueryId queryId, String allocationTag, MemoryPool memoryPool, Optional<DataSize> maxQueryMemory)
    {
        this.queryId = requireNonNull(queryId, "queryId is null");
        this.allocationTag = requireNonNull(allocationTag, "allocationTag is null");
        this.memoryPool = requireNonNull(memoryPool, "memoryPool is null");
        this.maxBytes = requireNonNull(maxQueryMemory, "maxQueryMemory is null")
                .map(DataSize::toBytes)
                .orElse(Long.MAX_VALUE);
    }

    public QueryId getQueryId()
    {
        return queryId;
    }

    /**
     * @return false if the query limit or the pool cannot accommodate {@code bytes}
     */
    public synchronized boolean tryConsume(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        if (bytes > maxBytes - consumedBytes) {
            return false;
        }
        if (!memoryPool.tryReserve(queryId, allocationTag, bytes)) {
            return false;
        }
        consumedBytes += bytes;
        return true;
    }

    public synchronized void release(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        checkArgument(bytes <= consumedBytes, "tried to release more memory than is consumed");
        memoryPool.free(queryId, allocationTag, bytes);
        consumedBytes -= bytes;
    }

    public synchronized long getConsumedBytes()
    {
        return consumedBytes;
    }

    @Override
    public synchronized String toString()
    {
        return toStringHelper(this)
                .add("queryId", queryId)
                .add("allocationTag", allocationTag)
                .add("consumedBytes", consumedBytes)
                .add("maxBytes", maxBytes)
                .toString();
    }
}
