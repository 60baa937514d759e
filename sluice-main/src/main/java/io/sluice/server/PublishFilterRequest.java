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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sluice.common.filter.SerializedBloomFilter;

import javax.annotation.concurrent.Immutable;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An aggregated bloom filter, pushed from the coordinator to every worker that consumes it.
 * The query is identified by the request path.
 */
@Immutable
public class PublishFilterRequest
{
    private final int filterId;
    private final SerializedBloomFilter bloomFilter;

    @JsonCreator
    public PublishFilterRequest(
            @JsonProperty("filterId") int filterId,
            @JsonProperty("bloomFilter") SerializedBloomFilter bloomFilter)
    {
        checkArgument(filterId >= 0, "filterId is negative");
        this.filterId = filterId;
        this.bloomFilter = requireNonNull(bloomFilter, "bloomFilter is null");
    }

    @JsonProperty
    public int getFilterId()
    {
        return filterId;
    }

    @JsonProperty
    public SerializedBloomFilter getBloomFilter()
    {
        return bloomFilter;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("filterId", filterId)
                .add("bloomFilter", bloomFilter)
                .toString();
    }
}
