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
package io.sluice.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.concurrent.Immutable;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Wire form of a {@link BloomFilter}. Carries the capacity exponent so the receiver can
 * reserve memory before decoding the directory.
 */
@Immutable
public class SerializedBloomFilter
{
    private static final byte[] EMPTY_DIRECTORY = new byte[0];
    private static final SerializedBloomFilter ALWAYS_TRUE = new SerializedBloomFilter(0, EMPTY_DIRECTORY, true);

    private final int logHeapSpace;
    private final byte[] directory;
    private final boolean alwaysTrue;

    @JsonCreator
    public SerializedBloomFilter(
            @JsonProperty("logHeapSpace") int logHeapSpace,
            @JsonProperty("directory") byte[] directory,
            @JsonProperty("alwaysTrue") boolean alwaysTrue)
    {
        checkArgument(logHeapSpace >= 0, "logHeapSpace is negative");
        this.logHeapSpace = logHeapSpace;
        this.directory = requireNonNull(directory, "directory is null").clone();
        this.alwaysTrue = alwaysTrue;
        checkArgument(!alwaysTrue || directory.length == 0, "always true filter must not carry a directory");
    }

    public static SerializedBloomFilter alwaysTrue()
    {
        return ALWAYS_TRUE;
    }

    @JsonProperty
    public int getLogHeapSpace()
    {
        return logHeapSpace;
    }

    @JsonProperty
    public byte[] getDirectory()
    {
        return directory.clone();
    }

    @JsonProperty
    public boolean isAlwaysTrue()
    {
        return alwaysTrue;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("logHeapSpace", logHeapSpace)
                .add("directoryBytes", directory.length)
                .add("alwaysTrue", alwaysTrue)
                .toString();
    }
}
