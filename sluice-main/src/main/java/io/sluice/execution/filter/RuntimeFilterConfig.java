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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;
import io.airlift.units.Duration;
import io.airlift.units.MaxDataSize;
import io.airlift.units.MinDuration;
import io.sluice.util.PowerOfTwo;

import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.KILOBYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static io.sluice.execution.filter.RuntimeFilterMode.GLOBAL;
import static java.util.concurrent.TimeUnit.SECONDS;

public class RuntimeFilterConfig
{
    private double maxErrorRate = 0.75;
    private DataSize minFilterSize = new DataSize(4, KILOBYTE);
    private DataSize maxFilterSize = new DataSize(16, MEGABYTE);
    private DataSize filterSize = new DataSize(1, MEGABYTE);
    private RuntimeFilterMode mode = GLOBAL;
    private Duration waitTime = new Duration(1, SECONDS);
    private int dispatcherThreads = 8;
    private int dispatcherQueueSize = 1024;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public double getMaxErrorRate()
    {
        return maxErrorRate;
    }

    @Config("runtime-filter.max-error-rate")
    @ConfigDescription("The maximum probability of false positives in a runtime filter before it is disabled")
    public RuntimeFilterConfig setMaxErrorRate(double maxErrorRate)
    {
        this.maxErrorRate = maxErrorRate;
        return this;
    }

    @NotNull
    @PowerOfTwo
    public DataSize getMinFilterSize()
    {
        return minFilterSize;
    }

    @Config("runtime-filter.min-filter-size")
    public RuntimeFilterConfig setMinFilterSize(DataSize minFilterSize)
    {
        this.minFilterSize = minFilterSize;
        return this;
    }

    @NotNull
    @PowerOfTwo
    @MaxDataSize("1GB")
    public DataSize getMaxFilterSize()
    {
        return maxFilterSize;
    }

    @Config("runtime-filter.max-filter-size")
    public RuntimeFilterConfig setMaxFilterSize(DataSize maxFilterSize)
    {
        this.maxFilterSize = maxFilterSize;
        return this;
    }

    @NotNull
    public DataSize getFilterSize()
    {
        return filterSize;
    }

    @Config("runtime-filter.filter-size")
    @ConfigDescription("Default target size of a runtime filter, rounded up to a power of two within the size bounds")
    public RuntimeFilterConfig setFilterSize(DataSize filterSize)
    {
        this.filterSize = filterSize;
        return this;
    }

    @NotNull
    public RuntimeFilterMode getMode()
    {
        return mode;
    }

    @Config("runtime-filter.mode")
    public RuntimeFilterConfig setMode(RuntimeFilterMode mode)
    {
        this.mode = mode;
        return this;
    }

    @NotNull
    @MinDuration("0ms")
    public Duration getWaitTime()
    {
        return waitTime;
    }

    @Config("runtime-filter.wait-time")
    @ConfigDescription("How long a scan operator waits for a runtime filter before it proceeds without it")
    public RuntimeFilterConfig setWaitTime(Duration waitTime)
    {
        this.waitTime = waitTime;
        return this;
    }

    @Min(1)
    public int getDispatcherThreads()
    {
        return dispatcherThreads;
    }

    @Config("runtime-filter.dispatcher-threads")
    public RuntimeFilterConfig setDispatcherThreads(int dispatcherThreads)
    {
        this.dispatcherThreads = dispatcherThreads;
        return this;
    }

    @Min(1)
    public int getDispatcherQueueSize()
    {
        return dispatcherQueueSize;
    }

    @Config("runtime-filter.dispatcher-queue-size")
    public RuntimeFilterConfig setDispatcherQueueSize(int dispatcherQueueSize)
    {
        this.dispatcherQueueSize = dispatcherQueueSize;
        return this;
    }

    @AssertTrue(message = "runtime-filter.min-filter-size must not be larger than runtime-filter.max-filter-size")
    public boolean isFilterSizeRangeValid()
    {
        return minFilterSize == null || maxFilterSize == null || minFilterSize.toBytes() <= maxFilterSize.toBytes();
    }
}
