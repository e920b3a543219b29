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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;
import io.airlift.units.MinDuration;
import jakarta.validation.constraints.NotNull;

import java.net.URI;
import java.util.Optional;

import static java.util.concurrent.TimeUnit.SECONDS;

public class RoleChainConfig
{
    private Optional<String> region = Optional.empty();
    private Optional<URI> stsEndpoint = Optional.empty();
    private Duration stsApiCallTimeout = new Duration(30, SECONDS);

    @NotNull
    public Optional<String> getRegion()
    {
        return region;
    }

    @Config("role-chain.region")
    @ConfigDescription("Region used for STS calls, defaults to the AWS SDK region lookup")
    public RoleChainConfig setRegion(String region)
    {
        this.region = Optional.ofNullable(region);
        return this;
    }

    @NotNull
    public Optional<URI> getStsEndpoint()
    {
        return stsEndpoint;
    }

    @Config("role-chain.sts.endpoint")
    @ConfigDescription("Override of the STS endpoint, e.g. a regional or VPC endpoint")
    public RoleChainConfig setStsEndpoint(URI stsEndpoint)
    {
        this.stsEndpoint = Optional.ofNullable(stsEndpoint);
        return this;
    }

    @MinDuration("1ms")
    public Duration getStsApiCallTimeout()
    {
        return stsApiCallTimeout;
    }

    @Config("role-chain.sts.api-call-timeout")
    @ConfigDescription("Maximum time for a single STS call")
    public RoleChainConfig setStsApiCallTimeout(Duration stsApiCallTimeout)
    {
        this.stsApiCallTimeout = stsApiCallTimeout;
        return this;
    }
}
