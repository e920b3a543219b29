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
package io.trino.aws.rolechain.sts;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.trino.aws.rolechain.RoleChainConfig;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import jakarta.annotation.PreDestroy;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsAsyncClient;
import software.amazon.awssdk.services.sts.StsAsyncClientBuilder;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityResponse;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkState;
import static io.trino.aws.rolechain.sdk.SdkCredentials.toAwsCredentials;
import static java.util.Objects.requireNonNull;

/**
 * {@link RoleDelegationClient} backed by the AWS SDK. One STS client is kept per
 * region; the calling identity is applied to each request, never to the client.
 */
public class StsRoleDelegationClient
        implements RoleDelegationClient
{
    private static final Logger log = Logger.get(StsRoleDelegationClient.class);

    private final Optional<URI> endpoint;
    private final Duration apiCallTimeout;
    private final Map<Optional<Region>, StsAsyncClient> clients = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Inject
    public StsRoleDelegationClient(RoleChainConfig config)
    {
        requireNonNull(config, "config is null");
        this.endpoint = config.getStsEndpoint();
        this.apiCallTimeout = config.getStsApiCallTimeout().toJavaTime();
    }

    @PreDestroy
    public void shutdown()
    {
        closed = true;
        clients.values().forEach(StsAsyncClient::close);
        clients.clear();
    }

    @Override
    public CompletableFuture<AssumeRoleResponse> assumeRole(AssumeRoleRequest request, Credentials caller, Optional<Region> region)
    {
        requireNonNull(caller, "caller is null");
        AssumeRoleRequest scopedRequest = request.toBuilder()
                .overrideConfiguration(override -> override
                        .credentialsProvider(StaticCredentialsProvider.create(toAwsCredentials(caller)))
                        .apiCallTimeout(apiCallTimeout))
                .build();
        return client(region).assumeRole(scopedRequest);
    }

    @Override
    public CompletableFuture<AssumeRoleWithWebIdentityResponse> assumeRoleWithWebIdentity(AssumeRoleWithWebIdentityRequest request, Optional<Region> region)
    {
        AssumeRoleWithWebIdentityRequest scopedRequest = request.toBuilder()
                .overrideConfiguration(override -> override
                        .credentialsProvider(AnonymousCredentialsProvider.create())
                        .apiCallTimeout(apiCallTimeout))
                .build();
        return client(region).assumeRoleWithWebIdentity(scopedRequest);
    }

    private StsAsyncClient client(Optional<Region> region)
    {
        requireNonNull(region, "region is null");
        checkState(!closed, "STS client has been shut down");
        return clients.computeIfAbsent(region, key -> {
            log.debug("Creating STS client for region %s", key.map(Region::id).orElse("<default>"));
            StsAsyncClientBuilder builder = StsAsyncClient.builder()
                    .credentialsProvider(AnonymousCredentialsProvider.create());
            key.ifPresent(builder::region);
            endpoint.ifPresent(builder::endpointOverride);
            return builder.build();
        });
    }
}
