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

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.trino.aws.rolechain.providers.StaticCredentialsSupplier;
import io.trino.aws.rolechain.providers.WebIdentityTokenCredentialsSupplier;
import io.trino.aws.rolechain.registry.NamedProviderRegistry;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;
import io.trino.aws.rolechain.spi.exception.UnknownProviderException;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.NamedSource;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.StaticKeyPair;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.WebIdentityTokenRole;
import io.trino.aws.rolechain.spi.profile.ProfileChain;
import io.trino.aws.rolechain.spi.profile.RoleHopSpec;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.trino.aws.rolechain.providers.WebIdentityTokenCredentialsSupplier.SESSION_NAME_PURPOSE;
import static java.util.Objects.requireNonNull;

/**
 * Turns a declarative {@link ProfileChain} into a {@link ResolvedChain}. Building
 * never performs remote calls: the base provider is looked up or constructed and
 * every hop is only described.
 */
public class ChainBuilder
{
    private static final Logger log = Logger.get(ChainBuilder.class);

    private final ClientConfiguration clientConfiguration;
    private final SessionNameGenerator sessionNameGenerator;

    @Inject
    public ChainBuilder(ClientConfiguration clientConfiguration, SessionNameGenerator sessionNameGenerator)
    {
        this.clientConfiguration = requireNonNull(clientConfiguration, "clientConfiguration is null");
        this.sessionNameGenerator = requireNonNull(sessionNameGenerator, "sessionNameGenerator is null");
    }

    /**
     * @throws UnknownProviderException if the base references a name missing from {@code registry}
     */
    public ResolvedChain build(NamedProviderRegistry registry, ProfileChain profileChain)
    {
        requireNonNull(registry, "registry is null");
        requireNonNull(profileChain, "profileChain is null");

        CredentialsSupplier base = resolveBase(registry, profileChain.base());
        log.info("First credentials will be loaded from %s", profileChain.base());

        List<DelegationHop> hops = profileChain.hops().stream()
                .map(this::toHop)
                .collect(toImmutableList());

        return new ResolvedChain(base, hops);
    }

    private CredentialsSupplier resolveBase(NamedProviderRegistry registry, BaseProviderSpec base)
    {
        if (base instanceof NamedSource namedSource) {
            return registry.provider(namedSource.name())
                    .orElseThrow(() -> {
                        log.debug("No provider named %s, registered names: %s", namedSource.name(), registry.names());
                        return new UnknownProviderException(namedSource.name());
                    });
        }
        if (base instanceof StaticKeyPair staticKeyPair) {
            return new StaticCredentialsSupplier(staticKeyPair.accessKeyId(), staticKeyPair.secretAccessKey(), staticKeyPair.sessionToken());
        }
        if (base instanceof WebIdentityTokenRole webIdentityTokenRole) {
            String sessionName = webIdentityTokenRole.sessionName()
                    .orElseGet(() -> sessionNameGenerator.defaultSessionName(SESSION_NAME_PURPOSE));
            return new WebIdentityTokenCredentialsSupplier(webIdentityTokenRole.tokenFile(), webIdentityTokenRole.roleArn(), sessionName, clientConfiguration);
        }
        throw new IllegalArgumentException("Unsupported base provider: " + base.getClass().getName());
    }

    private DelegationHop toHop(RoleHopSpec hopSpec)
    {
        log.info("Credentials will then be used to assume role %s", hopSpec.roleArn());
        return new DelegationHop(hopSpec.roleArn(), hopSpec.externalId(), hopSpec.sessionName(), sessionNameGenerator);
    }
}
