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

import com.google.common.collect.ImmutableMap;
import io.airlift.units.DataSize;
import io.airlift.units.Duration;
import io.sluice.util.PowerOfTwo;
import org.testng.annotations.Test;

import javax.validation.constraints.AssertTrue;

import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static io.airlift.testing.ValidationAssertions.assertFailsValidation;
import static io.airlift.testing.ValidationAssertions.assertValidates;
import static io.airlift.units.DataSize.Unit.KILOBYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static io.sluice.execution.filter.RuntimeFilterMode.GLOBAL;
import static io.sluice.execution.filter.RuntimeFilterMode.LOCAL;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

public class TestRuntimeFilterConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(RuntimeFilterConfig.class)
                .setMaxErrorRate(0.75)
                .setMinFilterSize(new DataSize(4, KILOBYTE))
                .setMaxFilterSize(new DataSize(16, MEGABYTE))
                .setFilterSize(new DataSize(1, MEGABYTE))
                .setMode(GLOBAL)
                .setWaitTime(new Duration(1, SECONDS))
                .setDispatcherThreads(8)
                .setDispatcherQueueSize(1024));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("runtime-filter.max-error-rate", "0.5")
                .put("runtime-filter.min-filter-size", "8kB")
                .put("runtime-filter.max-filter-size", "64MB")
                .put("runtime-filter.filter-size", "2MB")
                .put("runtime-filter.mode", "LOCAL")
                .put("runtime-filter.wait-time", "250ms")
                .put("runtime-filter.dispatcher-threads", "4")
                .put("runtime-filter.dispatcher-queue-size", "100")
                .build();

        RuntimeFilterConfig expected = new RuntimeFilterConfig()
                .setMaxErrorRate(0.5)
                .setMinFilterSize(new DataSize(8, KILOBYTE))
                .setMaxFilterSize(new DataSize(64, MEGABYTE))
                .setFilterSize(new DataSize(2, MEGABYTE))
                .setMode(LOCAL)
                .setWaitTime(new Duration(250, MILLISECONDS))
                .setDispatcherThreads(4)
                .setDispatcherQueueSize(100);

        assertFullMapping(properties, expected);
    }

    @Test
    public void testValidation()
    {
        assertValidates(new RuntimeFilterConfig());

        assertFailsValidation(
                new RuntimeFilterConfig().setMinFilterSize(new DataSize(3, KILOBYTE)),
                "minFilterSize",
                "is not a power of two",
                PowerOfTwo.class);

        assertFailsValidation(
                new RuntimeFilterConfig().setMaxFilterSize(new DataSize(12, MEGABYTE)),
                "maxFilterSize",
                "is not a power of two",
                PowerOfTwo.class);

        assertFailsValidation(
                new RuntimeFilterConfig()
                        .setMinFilterSize(new DataSize(32, MEGABYTE))
                        .setMaxFilterSize(new DataSize(16, MEGABYTE)),
                "filterSizeRangeValid",
                "runtime-filter.min-filter-size must not be larger than runtime-filter.max-filter-size",
                AssertTrue.class);
    }
}
