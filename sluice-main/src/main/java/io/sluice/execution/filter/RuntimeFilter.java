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
import io.airlift.slice.Slice;
import io.airlift.units.Duration;
import io.sluice.common.filter.BloomFilter;

import javax.annotation.concurrent.ThreadSafe;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.airlift.units.Duration.succinctNanos;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * One runtime filter of a query, either built on this node (produced) or awaited by a scan
 * operator on this node (consumed). The bloom filter is set at most once and is never mutated
 * afterwards, so readers need no lock.
 */
@ThreadSafe
public class RuntimeFilter
{
    public static final int SLEEP_PERIOD_MS = 20;

    private final RuntimeFilterDescriptor descriptor;
    private final Duration waitTime;
    private final Ticker ticker;
    private final long registrationNanos;

    // arrivalNanos is written before bloomFilter
    private volatile long arrivalNanos;
    private volatile BloomFilter bloomFilter;

    RuntimeFilter(RuntimeFilterDescriptor descriptor, Duration waitTime, Ticker ticker)
    {
        this.descriptor = requireNonNull(descriptor, "descriptor is null");
        this.waitTime = requireNonNull(waitTime, "waitTime is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
        this.registrationNanos = ticker.read();
    }

    public int getFilterId()
    {
        return descriptor.getFilterId();
    }

    public RuntimeFilterDescriptor getDescriptor()
    {
        return descriptor;
    }

    /**
     * How long {@link #waitForArrival()} waits for this filter, measured from registration.
     */
    public Duration getWaitTime()
    {
        return waitTime;
    }

    public boolean hasBloomFilter()
    {
        return bloomFilter != null;
    }

    public Optional<BloomFilter> getBloomFilter()
    {
        return Optional.ofNullable(bloomFilter);
    }

    public boolean isAlwaysTrue()
    {
        BloomFilter filter = bloomFilter;
        return filter != null && filter.isAlwaysTrue();
    }

    synchronized void setBloomFilter(BloomFilter bloomFilter)
    {
        requireNonNull(bloomFilter, "bloomFilter is null");
        checkState(this.bloomFilter == null, "Runtime filter %s already has a bloom filter", descriptor.getFilterId());
        arrivalNanos = ticker.read();
        this.bloomFilter = bloomFilter;
    }

    /**
     * Time between registration and arrival of the bloom filter, or empty while the filter is pending.
     */
    public Optional<Duration> getArrivalDelay()
    {
        if (bloomFilter == null) {
            return Optional.empty();
        }
        return Optional.of(succinctNanos(Math.max(0, arrivalNanos - registrationNanos)));
    }

    /**
     * Rows can only be dropped when this returns false. A pending filter keeps every row.
     */
    public boolean mightContain(long value)
    {
        BloomFilter filter = bloomFilter;
        return filter == null || filter.find(value);
    }

    public boolean mightContain(Slice value)
    {
        BloomFilter filter = bloomFilter;
        return filter == null || filter.find(value);
    }

    public boolean waitForArrival()
    {
        return waitForArrival(waitTime.toMillis());
    }

    public boolean waitForArrival(BooleanSupplier cancelled)
    {
        return waitForArrival(waitTime.toMillis(), cancelled);
    }

    public boolean waitForArrival(long timeoutMillis)
    {
        return waitForArrival(timeoutMillis, () -> false);
    }

    /**
     * Polls for the bloom filter every {@value #SLEEP_PERIOD_MS} ms until it arrives, until
     * {@code timeoutMillis} have passed since the filter was registered, or until
     * {@code cancelled} reports true.
     *
     * @return whether the bloom filter has arrived
     */
    public boolean waitForArrival(long timeoutMillis, BooleanSupplier cancelled)
    {
        checkArgument(timeoutMillis >= 0, "timeoutMillis is negative");
        requireNonNull(cancelled, "cancelled is null");

        long timeoutNanos = MILLISECONDS.toNanos(timeoutMillis);
        do {
            if (hasBloomFilter()) {
                return true;
            }
            if (cancelled.getAsBoolean()) {
                return false;
            }
            try {
                MILLISECONDS.sleep(SLEEP_PERIOD_MS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return hasBloomFilter();
            }
        }
        while (ticker.read() - registrationNanos < timeoutNanos);
        return hasBloomFilter();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("filterId", descriptor.getFilterId())
                .add("hasLocalTarget", descriptor.hasLocalTarget())
                .add("waitTime", waitTime)
                .add("arrived", hasBloomFilter())
                .toString();
    }
}
