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
package io.trino.aws.rolechain.sdk;

import com.google.common.collect.ImmutableList;
import io.trino.aws.rolechain.chain.ChainExecutor;
import io.trino.aws.rolechain.chain.ClientConfiguration;
import io.trino.aws.rolechain.chain.DelegationHop;
import io.trino.aws.rolechain.chain.ResolvedChain;
import io.trino.aws.rolechain.providers.StaticCredentialsSupplier;
import io.trino.aws.rolechain.spi.exception.CredentialsProviderException;
import io.trino.aws.rolechain.testing.TestingRoleDelegationClient;
import io.trino.aws.rolechain.testing.TestingSessionNameGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Optional;

import static io.trino.aws.rolechain.testing.TestingRoleDelegationClient.EXPIRATION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestRoleChainCredentialsProvider
{
    private static final String ROLE = "arn:aws:iam::123456789012:role/reporting";

    private TestingRoleDelegationClient delegationClient;
    private ChainExecutor chainExecutor;

    @BeforeEach
    public void setUp()
    {
        delegationClient = new TestingRoleDelegationClient();
        chainExecutor = new ChainExecutor(new ClientConfiguration(delegationClient, Optional.empty()));
    }

    @Test
    public void testResolveCredentials()
    {
        RoleChainCredentialsProvider provider = new RoleChainCredentialsProvider(chainExecutor, chain());

        AwsCredentials credentials = provider.resolveCredentials();

        assertThat(credentials).isInstanceOf(AwsSessionCredentials.class);
        AwsSessionCredentials sessionCredentials = (AwsSessionCredentials) credentials;
        assertThat(sessionCredentials.accessKeyId()).isEqualTo("access-" + ROLE);
        assertThat(sessionCredentials.secretAccessKey()).isEqualTo("secret-" + ROLE);
        assertThat(sessionCredentials.sessionToken()).isEqualTo("token-" + ROLE);
        assertThat(sessionCredentials.expirationTime()).contains(EXPIRATION);
    }

    @Test
    public void testEveryResolutionRunsTheChain()
    {
        RoleChainCredentialsProvider provider = new RoleChainCredentialsProvider(chainExecutor, chain());

        provider.resolveCredentials();
        provider.resolveCredentials();

        assertThat(delegationClient.assumeRoleCalls()).hasSize(2);
        assertThat(provider.toString()).startsWith("RoleChainCredentialsProvider{chain=").contains(ROLE);
    }

    @Test
    public void testBaseOnlyChain()
    {
        ResolvedChain chain = new ResolvedChain(new StaticCredentialsSupplier("AKIDSTATIC", "static-secret", Optional.empty()), ImmutableList.of());

        AwsCredentials credentials = new RoleChainCredentialsProvider(chainExecutor, chain).resolveCredentials();

        assertThat(credentials).isEqualTo(AwsBasicCredentials.create("AKIDSTATIC", "static-secret"));
    }

    @Test
    public void testFailure()
    {
        delegationClient.failRole(ROLE);
        RoleChainCredentialsProvider provider = new RoleChainCredentialsProvider(chainExecutor, chain());

        assertThatThrownBy(provider::resolveCredentials)
                .isInstanceOf(SdkClientException.class)
                .hasMessageStartingWith("Unable to load credentials from role chain: Failed to assume role %s at hop 1 of 1".formatted(ROLE))
                .hasCauseInstanceOf(CredentialsProviderException.class);
    }

    private static ResolvedChain chain()
    {
        return new ResolvedChain(
                new StaticCredentialsSupplier("AKIDSTATIC", "static-secret", Optional.empty()),
                ImmutableList.of(new DelegationHop(ROLE, Optional.empty(), Optional.empty(), new TestingSessionNameGenerator())));
    }
}
