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
package io.trino.aws.rolechain.spi.plugin;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.binder.LinkedBindingBuilder;
import io.airlift.log.Logger;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;

import static com.google.inject.multibindings.MapBinder.newMapBinder;

public interface RoleChainBinding
{
    Logger log = Logger.get(RoleChainBinding.class);

    /**
     * Register {@code implementationClass} as the named credentials source {@code name},
     * so that profiles can reference it as their base provider.
     */
    static Module namedProviderModule(String name, Class<? extends CredentialsSupplier> implementationClass)
    {
        return binder -> {
            log.info("Registered %s implementation %s with name \"%s\"", CredentialsSupplier.class.getSimpleName(), implementationClass.getSimpleName(), name);
            bindNamedProvider(binder, name).to(implementationClass).in(Scopes.SINGLETON);
        };
    }

    static LinkedBindingBuilder<CredentialsSupplier> bindNamedProvider(Binder binder, String name)
    {
        return newMapBinder(binder, String.class, CredentialsSupplier.class).addBinding(name);
    }
}
