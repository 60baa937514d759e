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
package io.sluice.memory;

import com.google.common.collect.ImmutableMap;
import io.airlift.units.DataSize;
import io.sluice.common.QueryId;
import org.testng.annotations.Test;

import static io.airlift.units.DataSize.Unit.BYTE;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestMemoryPool
{
    private static final QueryId QUERY_1 = new QueryId("query_1");
    private static final QueryId QUERY_2 = new QueryId("query_2");

    @Test
    public void testReserveAndFree()
    {
        MemoryPool pool = new MemoryPool("test", new DataSize(1000, BYTE));

        assertTrue(pool.tryReserve(QUERY_1, "bank", 600));
        assertEquals(pool.getReservedBytes(), 600);
        assertEquals(pool.getFreeBytes(), 400);
        assertEquals(pool.getQueryMemoryReservation(QUERY_1), 600);

        // a rejected reservation reserves nothing
        assertFalse(pool.tryReserve(QUERY_2, "bank", 401));
        assertEquals(pool.getReservedBytes(), 600);
        assertEquals(pool.getQueryMemoryReservation(QUERY_2), 0);

        assertTrue(pool.tryReserve(QUERY_2, "bank", 400));
        assertEquals(pool.getFreeBytes(), 0);

        pool.free(QUERY_1, "bank", 600);
        pool.free(QUERY_2, "bank", 400);
        assertEquals(pool.getReservedBytes(), 0);
        assertEquals(pool.getFreeBytes(), 1000);
        assertTrue(pool.getTaggedMemoryAllocations().isEmpty());
    }

    @Test
    public void testTaggedAllocations()
    {
        MemoryPool pool = new MemoryPool("test", new DataSize(1000, BYTE));

        assertTrue(pool.tryReserve(QUERY_1, "bank", 100));
        assertTrue(pool.tryReserve(QUERY_1, "operator", 50));
        assertTrue(pool.tryReserve(QUERY_1, "bank", 10));
        assertEquals(pool.getTaggedMemoryAllocations(), ImmutableMap.of(QUERY_1, ImmutableMap.of("bank", 110L, "operator", 50L)));

        pool.free(QUERY_1, "operator", 50);
        assertEquals(pool.getTaggedMemoryAllocations(), ImmutableMap.of(QUERY_1, ImmutableMap.of("bank", 110L)));
        assertEquals(pool.getQueryMemoryReservation(QUERY_1), 110);
    }

    @Test
    public void testZeroByteReservation()
    {
        MemoryPool pool = new MemoryPool("test", new DataSize(10, BYTE));
        assertTrue(pool.tryReserve(QUERY_1, "bank", 0));
        assertEquals(pool.getReservedBytes(), 0);
        pool.free(QUERY_1, "bank", 0);
        assertEquals(pool.getReservedBytes(), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "tried to free more memory than is reserved")
    public void testFreeMoreThanReserved()
    {
        MemoryPool pool = new MemoryPool("test", new DataSize(10, BYTE));
        assertTrue(pool.tryReserve(QUERY_1, "bank", 5));
        pool.free(QUERY_1, "bank", 6);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "tried to free more memory than is reserved by query")
    public void testFreeMoreThanReservedByQuery()
    {
        MemoryPool pool = new MemoryPool("test", new DataSize(10, BYTE));
        assertTrue(pool.tryReserve(QUERY_1, "bank", 5));
        assertTrue(pool.tryReserve(QUERY_2, "bank", 5));
        pool.free(QUERY_1, "bank", 6);
    }
}
