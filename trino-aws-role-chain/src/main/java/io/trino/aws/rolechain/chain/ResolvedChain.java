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

import com.google.common.collect.ImmutableList;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public record ResolvedChain(CredentialsSupplier base, List<DelegationHop> hops)
{
    public ResolvedChain
    {
        requireNonNull(base, "base is null");
        hops = ImmutableList.copyOf(requireNonNull(hops, "hops is null"));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("base", base.getClass().getSimpleName())
                .add("hops", hops)
                .toString();
    }
}
