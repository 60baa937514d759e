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

import io.airlift.json.JsonCodec;
import org.testng.annotations.Test;

import java.util.Arrays;

import static io.airlift.json.JsonCodec.jsonCodec;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestSerializedBloomFilter
{
    private static final JsonCodec<SerializedBloomFilter> CODEC = jsonCodec(SerializedBloomFilter.class);

    @Test
    public void testJson()
    {
        BloomFilter filter = new BloomFilter(8);
        filter.insert(123);
        filter.insert(456);

        SerializedBloomFilter serialized = CODEC.fromJson(CODEC.toJson(filter.serialize()));
        assertEquals(serialized.getLogHeapSpace(), 8);
        assertFalse(serialized.isAlwaysTrue());

        BloomFilter copy = BloomFilter.deserialize(serialized);
        assertTrue(copy.find(123));
        assertTrue(copy.find(456));
    }

    @Test
    public void testAlwaysTrueJson()
    {
        SerializedBloomFilter serialized = CODEC.fromJson(CODEC.toJson(SerializedBloomFilter.alwaysTrue()));
        assertTrue(serialized.isAlwaysTrue());
        assertEquals(serialized.getDirectory().length, 0);
    }

    @Test
    public void testDirectoryIsNotShared()
    {
        BloomFilter filter = new BloomFilter(8);
        filter.insert(123);
        SerializedBloomFilter serialized = filter.serialize();

        byte[] directory = serialized.getDirectory();
        assertTrue(BloomFilter.deserialize(serialized).find(123));
        Arrays.fill(directory, (byte) 0);
        assertTrue(BloomFilter.deserialize(serialized).find(123));

        byte[] bytes = new byte[(int) BloomFilter.getExpectedHeapSpaceUsed(8)];
        SerializedBloomFilter empty = new SerializedBloomFilter(8, bytes, false);
        Arrays.fill(bytes, (byte) 0xFF);
        assertFalse(BloomFilter.deserialize(empty).find(123));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "always true filter must not carry a directory")
    public void testAlwaysTrueWithDirectory()
    {
        new SerializedBloomFilter(10, new byte[32], true);
    }
}
