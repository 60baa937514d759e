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

import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.airlift.slice.XxHash64;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A block Bloom filter. The directory is split into 256-bit buckets of eight 32-bit words.
 * The high half of a key's hash selects a bucket and the low half, rehashed with a different
 * salt per word, selects one bit to set in each word of that bucket. All lookups for one key
 * therefore touch a single cache line.
 * <p>
 * A filter is written by exactly one thread while it is being built. Once it has been handed
 * to other threads it is only read.
 */
@NotThreadSafe
public final class BloomFilter
{
    /**
     * A filter that reports every key as possibly present. It owns no storage, so installing it
     * never charges memory.
     */
    public static final BloomFilter ALWAYS_TRUE_FILTER = new BloomFilter();

    public static final int MAX_LOG_HEAP_SPACE = 30;

    private static final int BUCKET_WORDS = 8;
    private static final int LOG_BUCKET_WORD_BITS = 5;
    private static final int LOG_BUCKET_BYTE_SIZE = 5;
    private static final int BUCKET_BYTES = 1 << LOG_BUCKET_BYTE_SIZE;

    private static final int[] REHASH = {
            0x47b6137b, 0x44974d91, 0x8824ad5b, 0xa2b7289d,
            0x705495c7, 0x2df1424b, 0x9efc4947, 0x5c6bfb31};

    private final int logHeapSpace;
    private final int directoryMask;
    @Nullable
    private final int[] directory;

    public BloomFilter(int logHeapSpace)
    {
        this(logHeapSpace, new int[(1 << logNumBuckets(checkLogHeapSpace(logHeapSpace))) * BUCKET_WORDS]);
    }

    private BloomFilter(int logHeapSpace, int[] directory)
    {
        this.logHeapSpace = logHeapSpace;
        this.directory = requireNonNull(directory, "directory is null");
        this.directoryMask = (1 << logNumBuckets(logHeapSpace)) - 1;
        checkArgument(directory.length == (directoryMask + 1) * BUCKET_WORDS, "directory has %s words, expected %s", directory.length, (directoryMask + 1) * BUCKET_WORDS);
    }

    private BloomFilter()
    {
        this.logHeapSpace = 0;
        this.directoryMask = 0;
        this.directory = null;
    }

    /**
     * @throws IllegalArgumentException if the encoded capacity or directory is malformed
     */
    public static BloomFilter deserialize(SerializedBloomFilter serialized)
    {
        requireNonNull(serialized, "serialized is null");
        if (serialized.isAlwaysTrue()) {
            return ALWAYS_TRUE_FILTER;
        }

        int logHeapSpace = checkLogHeapSpace(serialized.getLogHeapSpace());
        byte[] bytes = serialized.getDirectory();
        long expectedBytes = getExpectedHeapSpaceUsed(logHeapSpace);
        checkArgument(bytes.length == expectedBytes, "Malformed bloom filter: expected %s directory bytes, found %s", expectedBytes, bytes.length);

        Slice slice = Slices.wrappedBuffer(bytes);
        int[] directory = new int[bytes.length / Integer.BYTES];
        for (int i = 0; i < directory.length; i++) {
            directory[i] = slice.getInt(i * Integer.BYTES);
        }
        return new BloomFilter(logHeapSpace, directory);
    }

    public SerializedBloomFilter serialize()
    {
        if (isAlwaysTrue()) {
            return SerializedBloomFilter.alwaysTrue();
        }
        return new SerializedBloomFilter(logHeapSpace, Slices.wrappedIntArray(directory).getBytes(), false);
    }

    public void insert(long value)
    {
        insertHash(XxHash64.hash(value));
    }

    public void insert(Slice value)
    {
        insertHash(XxHash64.hash(value));
    }

    public void insertHash(long hash)
    {
        checkState(!isAlwaysTrue(), "Cannot insert into the always true filter");
        int offset = bucketOffset(hash);
        int bucketHash = (int) hash;
        for (int i = 0; i < BUCKET_WORDS; i++) {
            directory[offset + i] |= 1 << ((bucketHash * REHASH[i]) >>> (Integer.SIZE - LOG_BUCKET_WORD_BITS));
        }
    }

    public boolean find(long value)
    {
        return findHash(XxHash64.hash(value));
    }

    public boolean find(Slice value)
    {
        return findHash(XxHash64.hash(value));
    }

    public boolean findHash(long hash)
    {
        if (isAlwaysTrue()) {
            return true;
        }
        int offset = bucketOffset(hash);
        int bucketHash = (int) hash;
        for (int i = 0; i < BUCKET_WORDS; i++) {
            int bit = 1 << ((bucketHash * REHASH[i]) >>> (Integer.SIZE - LOG_BUCKET_WORD_BITS));
            if ((directory[offset + i] & bit) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Adds every key of {@code other} to this filter. Both filters must have the same capacity.
     */
    public void merge(BloomFilter other)
    {
        requireNonNull(other, "other is null");
        checkState(!isAlwaysTrue(), "Cannot merge into the always true filter");
        checkArgument(!other.isAlwaysTrue(), "Cannot merge the always true filter");
        checkArgument(logHeapSpace == other.logHeapSpace, "Cannot merge filters of different sizes: %s and %s", logHeapSpace, other.logHeapSpace);
        for (int i = 0; i < directory.length; i++) {
            directory[i] |= other.directory[i];
        }
    }

    public boolean isAlwaysTrue()
    {
        return directory == null;
    }

    public int getLogHeapSpace()
    {
        return logHeapSpace;
    }

    public long getHeapSpaceUsed()
    {
        if (isAlwaysTrue()) {
            return 0;
        }
        return (long) directory.length * Integer.BYTES;
    }

    public static long getExpectedHeapSpaceUsed(int logHeapSpace)
    {
        checkLogHeapSpace(logHeapSpace);
        return BUCKET_BYTES * (1L << logNumBuckets(logHeapSpace));
    }

    /**
     * Probability that a key which was never inserted is reported as present, once
     * {@code ndv} distinct keys have been inserted into a filter of the given capacity.
     */
    public static double falsePositiveProbability(long ndv, int logHeapSpace)
    {
        checkArgument(ndv >= 0, "ndv is negative");
        checkLogHeapSpace(logHeapSpace);
        double bits = 1L << (logHeapSpace + 3);
        return Math.pow(1 - Math.exp(-1.0 * BUCKET_WORDS * ndv / bits), BUCKET_WORDS);
    }

    private int bucketOffset(long hash)
    {
        return ((int) (hash >>> 32) & directoryMask) * BUCKET_WORDS;
    }

    // at least two buckets
    private static int logNumBuckets(int logHeapSpace)
    {
        return Math.max(1, logHeapSpace - LOG_BUCKET_BYTE_SIZE);
    }

    private static int checkLogHeapSpace(int logHeapSpace)
    {
        checkArgument(logHeapSpace >= 0 && logHeapSpace <= MAX_LOG_HEAP_SPACE, "logHeapSpace must be between 0 and %s: %s", MAX_LOG_HEAP_SPACE, logHeapSpace);
        return logHeapSpace;
    }

    @Override
    public String toString()
    {
        if (isAlwaysTrue()) {
            return toStringHelper(this)
                    .add("alwaysTrue", true)
                    .toString();
        }
        return toStringHelper(this)
                .add("logHeapSpace", logHeapSpace)
                .add("heapSpaceUsed", getHeapSpaceUsed())
                .toString();
    }
}
