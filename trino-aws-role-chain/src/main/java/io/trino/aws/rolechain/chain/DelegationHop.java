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

import io.airlift.log.Logger;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import io.trino.aws.rolechain.spi.exception.CredentialsProviderException;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.trino.aws.rolechain.chain.Failures.forwardCancellation;
import static io.trino.aws.rolechain.chain.Failures.unwrapCompletion;
import static io.trino.aws.rolechain.sdk.SdkCredentials.fromStsCredentials;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * One role assumption in a chain. The credentials passed to {@link #execute}
 * are the only identity used to call STS.
 */
public final class DelegationHop
{
    private static final Logger log = Logger.get(DelegationHop.class);

    public static final String PROVIDER_NAME = "AssumeRoleProvider";
    public static final String SESSION_NAME_PURPOSE = "assume-role-from-profile";

    private final String roleArn;
    private final Optional<String> externalId;
    private final Optional<String> sessionName;
    private final SessionNameGenerator sessionNameGenerator;

    public DelegationHop(String roleArn, Optional<String> externalId, Optional<String> sessionName, SessionNameGenerator sessionNameGenerator)
    {
        this.roleArn = requireNonNull(roleArn, "roleArn is null");
        this.externalId = requireNonNull(externalId, "externalId is null");
        this.sessionName = requireNonNull(sessionName, "sessionName is null");
        this.sessionNameGenerator = requireNonNull(sessionNameGenerator, "sessionNameGenerator is null");
    }

    public String roleArn()
    {
        return roleArn;
    }

    public Optional<String> externalId()
    {
        return externalId;
    }

    public Optional<String> sessionName()
    {
        return sessionName;
    }

    public CompletableFuture<Credentials> execute(Credentials upstreamCredentials, ClientConfiguration clientConfiguration)
    {
        requireNonNull(upstreamCredentials, "upstreamCredentials is null");
        requireNonNull(clientConfiguration, "clientConfiguration is null");

        // resolved per call, never at build time
        String roleSessionName = sessionName.orElseGet(() -> sessionNameGenerator.defaultSessionName(SESSION_NAME_PURPOSE));

        AssumeRoleRequest.Builder request = AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(roleSessionName);
        externalId.ifPresent(request::externalId);

        log.debug("Assuming role %s as %s with session name %s", roleArn, upstreamCredentials.accessKeyId(), roleSessionName);

        CompletableFuture<AssumeRoleResponse> call;
        try {
            call = clientConfiguration.delegationClient().assumeRole(request.build(), upstreamCredentials, clientConfiguration.region());
        }
        catch (RuntimeException e) {
            return failedFuture(assumeRoleFailure(e));
        }

        CompletableFuture<Credentials> credentials = call.handle((response, throwable) -> {
            if (throwable != null) {
                throw assumeRoleFailure(throwable);
            }
            if (response == null || response.credentials() == null) {
                throw new CredentialsProviderException(PROVIDER_NAME, "Assuming role %s returned no credentials".formatted(roleArn));
            }
            return fromStsCredentials(response.credentials(), PROVIDER_NAME);
        });
        return forwardCancellation(credentials, call);
    }

    private RuntimeException assumeRoleFailure(Throwable throwable)
    {
        Throwable cause = unwrapCompletion(throwable);
        if (cause instanceof CancellationException cancellationException) {
            return cancellationException;
        }
        return new CredentialsProviderException(PROVIDER_NAME, "Failed to assume role %s".formatted(roleArn), cause);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("roleArn", roleArn)
                .add("externalId", externalId.orElse(null))
                .add("sessionName", sessionName.orElse(null))
                .omitNullValues()
                .toString();
    }
}
