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

import io.airlift.slice.Slices;
import org.testng.annotations.Test;

import java.util.Random;

import static io.sluice.common.filter.BloomFilter.ALWAYS_TRUE_FILTER;
import static io.sluice.common.filter.BloomFilter.falsePositiveProbability;
import static io.sluice.common.filter.BloomFilter.getExpectedHeapSpaceUsed;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestBloomFilter
{
    @Test
    public void testNoFalseNegatives()
    {
        BloomFilter filter = new BloomFilter(16);
        Random random = new Random(42);
        long[] values = new long[5_000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextLong();
            filter.insert(values[i]);
        }
        for (long value : values) {
            assertTrue(filter.find(value));
        }
    }

    @Test
    public void testSliceKeys()
    {
        BloomFilter filter = new BloomFilter(12);
        filter.insert(Slices.utf8Slice("alpha"));
        filter.insert(Slices.utf8Slice("beta"));
        assertTrue(filter.find(Slices.utf8Slice("alpha")));
        assertTrue(filter.find(Slices.utf8Slice("beta")));
    }

    @Test
    public void testEmptyFilterFindsNothing()
    {
        BloomFilter filter = new BloomFilter(10);
        for (long value = 0; value < 1_000; value++) {
            assertFalse(filter.find(value));
        }
    }

    @Test
    public void testObservedFalsePositiveRate()
    {
        int logHeapSpace = 13;
        int ndv = 2_000;
        BloomFilter filter = new BloomFilter(logHeapSpace);
        for (long value = 0; value < ndv; value++) {
            filter.insert(value);
        }

        int lookups = 100_000;
        int falsePositives = 0;
        for (long value = ndv; value < ndv + lookups; value++) {
            if (filter.find(value)) {
                falsePositives++;
            }
        }
        double expected = falsePositiveProbability(ndv, logHeapSpace);
        // blocked filters are somewhat worse than the classic estimate
        assertTrue((double) falsePositives / lookups < expected * 3 + 0.001, "observed " + falsePositives + " false positives, estimate " + expected);
    }

    @Test
    public void testHeapSpace()
    {
        assertEquals(getExpectedHeapSpaceUsed(20), 1 << 20);
        assertEquals(getExpectedHeapSpaceUsed(12), 1 << 12);
        // never fewer than two buckets
        assertEquals(getExpectedHeapSpaceUsed(0), 64);
        assertEquals(getExpectedHeapSpaceUsed(6), 64);

        for (int logHeapSpace = 0; logHeapSpace <= 22; logHeapSpace++) {
            assertEquals(new BloomFilter(logHeapSpace).getHeapSpaceUsed(), getExpectedHeapSpaceUsed(logHeapSpace));
        }
    }

    @Test
    public void testFalsePositiveProbability()
    {
        assertEquals(falsePositiveProbability(0, 20), 0.0);
        double previous = 0;
        for (long ndv = 1; ndv < 10_000_000; ndv *= 10) {
            double fpp = falsePositiveProbability(ndv, 20);
            assertTrue(fpp > previous);
            assertTrue(fpp <= 1.0);
            previous = fpp;
        }
        // a larger filter is more selective for the same cardinality
        assertTrue(falsePositiveProbability(100_000, 22) < falsePositiveProbability(100_000, 20));
    }

    @Test
    public void testMerge()
    {
        BloomFilter left = new BloomFilter(14);
        BloomFilter right = new BloomFilter(14);
        for (long value = 0; value < 500; value++) {
            left.insert(value);
            right.insert(value + 10_000);
        }
        left.merge(right);
        for (long value = 0; value < 500; value++) {
            assertTrue(left.find(value));
            assertTrue(left.find(value + 10_000));
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "Cannot merge filters of different sizes: 14 and 15")
    public void testMergeDifferentSizes()
    {
        new BloomFilter(14).merge(new BloomFilter(15));
    }

    @Test
    public void testAlwaysTrueFilter()
    {
        assertTrue(ALWAYS_TRUE_FILTER.isAlwaysTrue());
        assertEquals(ALWAYS_TRUE_FILTER.getHeapSpaceUsed(), 0);
        Random random = new Random(7);
        for (int i = 0; i < 1_000; i++) {
            assertTrue(ALWAYS_TRUE_FILTER.find(random.nextLong()));
        }
        assertTrue(ALWAYS_TRUE_FILTER.serialize().isAlwaysTrue());
        assertSame(BloomFilter.deserialize(SerializedBloomFilter.alwaysTrue()), ALWAYS_TRUE_FILTER);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testInsertIntoAlwaysTrueFilter()
    {
        ALWAYS_TRUE_FILTER.insert(1);
    }

    @Test
    public void testSerialization()
    {
        BloomFilter filter = new BloomFilter(11);
        for (long value = 0; value < 100; value++) {
            filter.insert(value * 31);
        }
        SerializedBloomFilter serialized = filter.serialize();
        assertEquals(serialized.getLogHeapSpace(), 11);
        assertEquals(serialized.getDirectory().length, getExpectedHeapSpaceUsed(11));
        assertFalse(serialized.isAlwaysTrue());

        BloomFilter copy = BloomFilter.deserialize(serialized);
        assertEquals(copy.getHeapSpaceUsed(), filter.getHeapSpaceUsed());
        for (long value = 0; value < 100; value++) {
            assertTrue(copy.find(value * 31));
        }
        for (long value = 0; value < 10_000; value++) {
            assertEquals(copy.find(value), filter.find(value));
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "Malformed bloom filter: expected 2048 directory bytes, found 100")
    public void testDeserializeTruncatedDirectory()
    {
        BloomFilter.deserialize(new SerializedBloomFilter(11, new byte[100], false));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "logHeapSpace must be between 0 and 30: 31")
    public void testDeserializeInvalidCapacity()
    {
        BloomFilter.deserialize(new SerializedBloomFilter(31, new byte[0], false));
    }
}
