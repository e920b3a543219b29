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
package io.trino.aws.rolechain;

import com.google.common.collect.ImmutableMap;
import io.airlift.units.Duration;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

public class TestRoleChainConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(RoleChainConfig.class)
                .setRegion(null)
                .setStsEndpoint(null)
                .setStsApiCallTimeout(new Duration(30, SECONDS)));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = ImmutableMap.<String, String>builder()
                .put("role-chain.region", "eu-central-1")
                .put("role-chain.sts.endpoint", "https://sts.eu-central-1.amazonaws.com")
                .put("role-chain.sts.api-call-timeout", "2500ms")
                .buildOrThrow();

        RoleChainConfig expected = new RoleChainConfig()
                .setRegion("eu-central-1")
                .setStsEndpoint(URI.create("https://sts.eu-central-1.amazonaws.com"))
                .setStsApiCallTimeout(new Duration(2500, MILLISECONDS));

        assertFullMapping(properties, expected);
    }
}
