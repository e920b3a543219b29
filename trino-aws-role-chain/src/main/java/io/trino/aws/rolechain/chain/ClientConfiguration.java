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
package io.trino.aws.rolechain.chain;

import io.trino.aws.rolechain.sts.RoleDelegationClient;
import software.amazon.awssdk.regions.Region;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Everything a chain needs to talk to STS: the client that issues the calls
 * and the region the calls are scoped to. An empty region defers to the
 * AWS SDK default region lookup.
 */
public record ClientConfiguration(RoleDelegationClient delegationClient, Optional<Region> region)
{
    public ClientConfiguration
    {
        requireNonNull(delegationClient, "delegationClient is null");
        requireNonNull(region, "region is null");
    }
}
