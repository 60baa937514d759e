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

import javax.annotation.concurrent.Immutable;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * Planner-assigned description of a runtime filter, fixed when a fragment is set up.
 */
@Immutable
public final class RuntimeFilterDescriptor
{
    private final int filterId;
    private final boolean hasLocalTarget;

    public RuntimeFilterDescriptor(int filterId, boolean hasLocalTarget)
    {
        checkArgument(filterId >= 0, "filterId is negative");
        this.filterId = filterId;
        this.hasLocalTarget = hasLocalTarget;
    }

    public int getFilterId()
    {
        return filterId;
    }

    /**
     * Whether the only consumer of this filter runs on the same node as its only producer, in
     * which case the filter is handed over directly instead of being aggregated.
     */
    public boolean hasLocalTarget()
    {
        return hasLocalTarget;
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
        RuntimeFilterDescriptor that = (RuntimeFilterDescriptor) o;
        return filterId == that.filterId &&
                hasLocalTarget == that.hasLocalTarget;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(filterId, hasLocalTarget);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("filterId", filterId)
                .add("hasLocalTarget", hasLocalTarget)
                .toString();
    }
}
