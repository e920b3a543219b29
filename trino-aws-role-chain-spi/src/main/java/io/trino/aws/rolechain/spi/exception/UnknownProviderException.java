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
package io.trino.aws.rolechain.spi.exception;

import static java.util.Objects.requireNonNull;

/**
 * A profile chain references a named credentials source that is not registered.
 * Raised while building the chain, before any credentials are requested.
 */
public class UnknownProviderException
        extends RoleChainException
{
    private final String name;

    public UnknownProviderException(String name)
    {
        super("profile referenced `%s` provider but that provider is not supported".formatted(requireNonNull(name, "name is null")));
        this.name = name;
    }

    public String name()
    {
        return name;
    }
}
