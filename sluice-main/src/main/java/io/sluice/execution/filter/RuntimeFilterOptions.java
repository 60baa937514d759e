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

import io.airlift.units.DataSize;
import io.airlift.units.Duration;

import javax.annotation.concurrent.Immutable;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Runtime filter settings of a single query. Defaults come from {@link RuntimeFilterConfig} and
 * may be overridden per query.
 */
@Immutable
public final class RuntimeFilterOptions
{
    private final RuntimeFilterMode mode;
    private final DataSize filterSize;
    private final Duration waitTime;

    public RuntimeFilterOptions(RuntimeFilterMode mode, DataSize filterSize, Duration waitTime)
    {
        this.mode = requireNonNull(mode, "mode is null");
        this.filterSize = requireNonNull(filterSize, "filterSize is null");
        this.waitTime = requireNonNull(waitTime, "waitTime is null");
    }

    public static RuntimeFilterOptions fromConfig(RuntimeFilterConfig config)
    {
        return new RuntimeFilterOptions(config.getMode(), config.getFilterSize(), config.getWaitTime());
    }

    public RuntimeFilterMode getMode()
    {
        return mode;
    }

    public DataSize getFilterSize()
    {
        return filterSize;
    }

    public Duration getWaitTime()
    {
        return waitTime;
    }

    public RuntimeFilterOptions withMode(RuntimeFilterMode mode)
    {
        return new RuntimeFilterOptions(mode, filterSize, waitTime);
    }

    public RuntimeFilterOptions withFilterSize(DataSize filterSize)
    {
        return new RuntimeFilterOptions(mode, filterSize, waitTime);
    }

    public RuntimeFilterOptions withWaitTime(Duration waitTime)
    {
        return new RuntimeFilterOptions(mode, filterSize, waitTime);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RuntimeFilterOptions that = (RuntimeFilterOptions) o;
        return mode == that.mode &&
                filterSize.equals(that.filterSize) &&
                waitTime.equals(that.waitTime);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(mode, filterSize, waitTime);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("mode", mode)
                .add("filterSize", filterSize)
                .add("waitTime", waitTime)
                .toString();
    }
}
