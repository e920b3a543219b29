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
package io.trino.aws.rolechain.registry;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Named credentials sources that a profile can reference as its base provider.
 * Immutable once built and shared by every chain built from it.
 */
public class NamedProviderRegistry
{
    private final Map<String, CredentialsSupplier> providers;

    public NamedProviderRegistry(Map<String, ? extends CredentialsSupplier> providers)
    {
        this.providers = ImmutableMap.copyOf(requireNonNull(providers, "providers is null"));
    }

    public static NamedProviderRegistry empty()
    {
        return new NamedProviderRegistry(ImmutableMap.of());
    }

    public Optional<CredentialsSupplier> provider(String name)
    {
        return Optional.ofNullable(providers.get(requireNonNull(name, "name is null")));
    }

    public Set<String> names()
    {
        return ImmutableSortedSet.copyOf(providers.keySet());
    }
}
