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

import io.airlift.stats.CounterStat;
import io.airlift.stats.TimeStat;
import io.airlift.units.Duration;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

public class RuntimeFilterStats
{
    private final CounterStat bloomFilterBytes = new CounterStat();
    private final CounterStat scratchFiltersAllocated = new CounterStat();
    private final CounterStat scratchAllocationsRejected = new CounterStat();
    private final CounterStat filtersArrived = new CounterStat();
    private final CounterStat alwaysTrueFallbacks = new CounterStat();
    private final CounterStat updatesDispatched = new CounterStat();
    private final CounterStat dispatchFailures = new CounterStat();
    private final TimeStat arrivalDelay = new TimeStat(MILLISECONDS);

    public void scratchFilterAllocated(long bytes)
    {
        scratchFiltersAllocated.update(1);
        bloomFilterBytes.update(bytes);
    }

    public void scratchAllocationRejected()
    {
        scratchAllocationsRejected.update(1);
    }

    public void globalFilterAllocated(long bytes)
    {
        bloomFilterBytes.update(bytes);
    }

    public void filterArrived(Duration delay)
    {
        filtersArrived.update(1);
        arrivalDelay.add(delay);
    }

    public void alwaysTrueFallback()
    {
        alwaysTrueFallbacks.update(1);
    }

    public void updateDispatched()
    {
        updatesDispatched.update(1);
    }

    public void dispatchFailed()
    {
        dispatchFailures.update(1);
    }

    @Managed
    @Nested
    public CounterStat getBloomFilterBytes()
    {
        return bloomFilterBytes;
    }

    @Managed
    @Nested
    public CounterStat getScratchFiltersAllocated()
    {
        return scratchFiltersAllocated;
    }

    @Managed
    @Nested
    public CounterStat getScratchAllocationsRejected()
    {
        return scratchAllocationsRejected;
    }

    @Managed
    @Nested
    public CounterStat getFiltersArrived()
    {
        return filtersArrived;
    }

    @Managed
    @Nested
    public CounterStat getAlwaysTrueFallbacks()
    {
        return alwaysTrueFallbacks;
    }

    @Managed
    @Nested
    public CounterStat getUpdatesDispatched()
    {
        return updatesDispatched;
    }

    @Managed
    @Nested
    public CounterStat getDispatchFailures()
    {
        return dispatchFailures;
    }

    @Managed
    @Nested
    public TimeStat getArrivalDelay()
    {
        return arrivalDelay;
    }
}
