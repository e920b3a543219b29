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
import com.google.common.collect.ImmutableMap;
import io.trino.aws.rolechain.providers.StaticCredentialsSupplier;
import io.trino.aws.rolechain.providers.WebIdentityTokenCredentialsSupplier;
import io.trino.aws.rolechain.registry.NamedProviderRegistry;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;
import io.trino.aws.rolechain.spi.exception.UnknownProviderException;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.NamedSource;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.StaticKeyPair;
import io.trino.aws.rolechain.spi.profile.BaseProviderSpec.WebIdentityTokenRole;
import io.trino.aws.rolechain.spi.profile.ProfileChain;
import io.trino.aws.rolechain.spi.profile.RoleHopSpec;
import io.trino.aws.rolechain.testing.TestingRoleDelegationClient;
import io.trino.aws.rolechain.testing.TestingSessionNameGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.trino.aws.rolechain.spi.profile.RoleHopSpec.assumeRole;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestChainBuilder
{
    private static final String ROLE_A = "arn:aws:iam::111111111111:role/A";
    private static final String ROLE_B = "arn:aws:iam::222222222222:role/B";

    private TestingRoleDelegationClient delegationClient;
    private TestingSessionNameGenerator sessionNameGenerator;
    private ChainBuilder chainBuilder;

    @BeforeEach
    public void setUp()
    {
        delegationClient = new TestingRoleDelegationClient();
        sessionNameGenerator = new TestingSessionNameGenerator();
        chainBuilder = new ChainBuilder(new ClientConfiguration(delegationClient, Optional.empty()), sessionNameGenerator);
    }

    @Test
    public void testUnknownNamedProvider()
    {
        ProfileChain profileChain = ProfileChain.of(new NamedSource("floozle"));

        assertThatThrownBy(() -> chainBuilder.build(NamedProviderRegistry.empty(), profileChain))
                .isInstanceOf(UnknownProviderException.class)
                .hasMessageContaining("floozle")
                .hasMessage("profile referenced `floozle` provider but that provider is not supported")
                .satisfies(exception -> assertThat(((UnknownProviderException) exception).name()).isEqualTo("floozle"));
        assertThat(delegationClient.totalCalls()).isZero();
    }

    @Test
    public void testUnknownNamedProviderWithHops()
    {
        NamedProviderRegistry registry = new NamedProviderRegistry(ImmutableMap.of("Environment", new StaticCredentialsSupplier("ak", "sk", Optional.empty())));
        ProfileChain profileChain = ProfileChain.of(new NamedSource("environment"), assumeRole(ROLE_A), assumeRole(ROLE_B));

        assertThatThrownBy(() -> chainBuilder.build(registry, profileChain))
                .isInstanceOf(UnknownProviderException.class)
                .hasMessageContaining("`environment`");
        assertThat(delegationClient.totalCalls()).isZero();
        assertThat(sessionNameGenerator.requestedPurposes()).isEmpty();
    }

    @Test
    public void testNamedProviderIsShared()
    {
        CredentialsSupplier shared = new StaticCredentialsSupplier("ak", "sk", Optional.empty());
        NamedProviderRegistry registry = new NamedProviderRegistry(ImmutableMap.of("Shared", shared));

        ResolvedChain first = chainBuilder.build(registry, ProfileChain.of(new NamedSource("Shared")));
        ResolvedChain second = chainBuilder.build(registry, ProfileChain.of(new NamedSource("Shared"), assumeRole(ROLE_A)));

        assertThat(first.base()).isSameAs(shared);
        assertThat(second.base()).isSameAs(shared);
        assertThat(delegationClient.totalCalls()).isZero();
    }

    @Test
    public void testHopOrderIsPreserved()
    {
        List<RoleHopSpec> hopSpecs = IntStream.range(0, 7)
                .mapToObj(index -> new RoleHopSpec(
                        "arn:aws:iam::%012d:role/hop-%s".formatted(index, index),
                        index % 2 == 0 ? Optional.of("external-" + index) : Optional.empty(),
                        index % 3 == 0 ? Optional.of("session-" + index) : Optional.empty()))
                .collect(toImmutableList());

        ResolvedChain chain = chainBuilder.build(NamedProviderRegistry.empty(), new ProfileChain(new StaticKeyPair("ak", "sk"), hopSpecs));

        assertThat(chain.hops()).hasSize(hopSpecs.size());
        for (int index = 0; index < hopSpecs.size(); index++) {
            DelegationHop hop = chain.hops().get(index);
            RoleHopSpec hopSpec = hopSpecs.get(index);
            assertThat(hop.roleArn()).isEqualTo(hopSpec.roleArn());
            assertThat(hop.externalId()).isEqualTo(hopSpec.externalId());
            assertThat(hop.sessionName()).isEqualTo(hopSpec.sessionName());
        }
        // hop session names are defaulted when the hop runs, not while building
        assertThat(sessionNameGenerator.requestedPurposes()).isEmpty();
        assertThat(delegationClient.totalCalls()).isZero();
    }

    @Test
    public void testEmptyChain()
    {
        ResolvedChain chain = chainBuilder.build(NamedProviderRegistry.empty(), ProfileChain.of(new StaticKeyPair("ak", "sk")));

        assertThat(chain.hops()).isEmpty();
    }

    @Test
    public void testStaticKeyPairBase()
    {
        ResolvedChain chain = chainBuilder.build(NamedProviderRegistry.empty(), ProfileChain.of(new StaticKeyPair("AKIDEXAMPLE", "secret")));

        assertThat(chain.base()).isInstanceOf(StaticCredentialsSupplier.class);
        Credentials credentials = chain.base().supplyCredentials().join();
        assertThat(credentials.accessKeyId()).isEqualTo("AKIDEXAMPLE");
        assertThat(credentials.secretAccessKey()).isEqualTo("secret");
        assertThat(credentials.sessionToken()).isEmpty();
        assertThat(credentials.expiration()).isEmpty();
        assertThat(credentials).isEqualTo(Credentials.build("AKIDEXAMPLE", "secret", StaticCredentialsSupplier.PROVIDER_NAME));
        assertThat(delegationClient.totalCalls()).isZero();
    }

    @Test
    public void testStaticKeyPairWithSessionToken()
    {
        ResolvedChain chain = chainBuilder.build(NamedProviderRegistry.empty(), ProfileChain.of(new StaticKeyPair("AKIDEXAMPLE", "secret", Optional.of("token"))));

        assertThat(chain.base().supplyCredentials().join().sessionToken()).contains("token");
    }

    @Test
    public void testWebIdentityTokenRoleBase()
    {
        Path tokenFile = Path.of("/var/run/secrets/token");
        ResolvedChain chain = chainBuilder.build(
                NamedProviderRegistry.empty(),
                ProfileChain.of(new WebIdentityTokenRole(ROLE_A, tokenFile, Optional.empty()), assumeRole(ROLE_B)));

        assertThat(chain.base()).isInstanceOf(WebIdentityTokenCredentialsSupplier.class);
        WebIdentityTokenCredentialsSupplier base = (WebIdentityTokenCredentialsSupplier) chain.base();
        assertThat(base.roleArn()).isEqualTo(ROLE_A);
        assertThat(base.tokenFile()).isEqualTo(tokenFile);
        assertThat(base.sessionName()).isEqualTo("web-identity-token-profile-1");
        assertThat(sessionNameGenerator.requestedPurposes()).containsExactly(WebIdentityTokenCredentialsSupplier.SESSION_NAME_PURPOSE);
        // the token file is only read when credentials are requested
        assertThat(delegationClient.totalCalls()).isZero();
    }

    @Test
    public void testWebIdentityTokenRoleExplicitSessionName()
    {
        ResolvedChain chain = chainBuilder.build(
                NamedProviderRegistry.empty(),
                ProfileChain.of(new WebIdentityTokenRole(ROLE_A, Path.of("token"), Optional.of("my-session"))));

        assertThat(((WebIdentityTokenCredentialsSupplier) chain.base()).sessionName()).isEqualTo("my-session");
        assertThat(sessionNameGenerator.requestedPurposes()).isEmpty();
    }

    @Test
    public void testResolvedChainIsImmutable()
    {
        ResolvedChain chain = chainBuilder.build(NamedProviderRegistry.empty(), ProfileChain.of(new StaticKeyPair("ak", "sk"), assumeRole(ROLE_A)));

        assertThat(chain.hops()).isInstanceOf(ImmutableList.class);
        assertThatThrownBy(() -> chain.hops().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
