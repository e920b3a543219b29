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
package io.trino.aws.rolechain.spi.profile;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Declarative form of a credentials chain as read from a profile: a base
 * provider followed by the roles to assume, in declaration order.
 */
public record ProfileChain(BaseProviderSpec base, List<RoleHopSpec> hops)
{
    public ProfileChain
    {
        requireNonNull(base, "base is null");
        hops = ImmutableList.copyOf(requireNonNull(hops, "hops is null"));
    }

    public static ProfileChain of(BaseProviderSpec base, RoleHopSpec... hops)
    {
        return new ProfileChain(base, ImmutableList.copyOf(hops));
    }
}
