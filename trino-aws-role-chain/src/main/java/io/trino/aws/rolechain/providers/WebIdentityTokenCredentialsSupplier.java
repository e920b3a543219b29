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
package io.trino.aws.rolechain.providers;

import io.airlift.log.Logger;
import io.trino.aws.rolechain.chain.ClientConfiguration;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;
import io.trino.aws.rolechain.spi.exception.CredentialsProviderException;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityResponse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.trino.aws.rolechain.chain.Failures.forwardCancellation;
import static io.trino.aws.rolechain.chain.Failures.unwrapCompletion;
import static io.trino.aws.rolechain.sdk.SdkCredentials.fromStsCredentials;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Exchanges the web identity token stored in a file for credentials of a role.
 * The token file is read again on every call, so rotated tokens are picked up.
 */
public class WebIdentityTokenCredentialsSupplier
        implements CredentialsSupplier
{
    private static final Logger log = Logger.get(WebIdentityTokenCredentialsSupplier.class);

    public static final String PROVIDER_NAME = "WebIdentityToken";
    public static final String SESSION_NAME_PURPOSE = "web-identity-token-profile";

    private final Path tokenFile;
    private final String roleArn;
    private final String sessionName;
    private final ClientConfiguration clientConfiguration;

    public WebIdentityTokenCredentialsSupplier(Path tokenFile, String roleArn, String sessionName, ClientConfiguration clientConfiguration)
    {
        this.tokenFile = requireNonNull(tokenFile, "tokenFile is null");
        this.roleArn = requireNonNull(roleArn, "roleArn is null");
        this.sessionName = requireNonNull(sessionName, "sessionName is null");
        this.clientConfiguration = requireNonNull(clientConfiguration, "clientConfiguration is null");
    }

    public Path tokenFile()
    {
        return tokenFile;
    }

    public String roleArn()
    {
        return roleArn;
    }

    public String sessionName()
    {
        return sessionName;
    }

    @Override
    public CompletableFuture<Credentials> supplyCredentials()
    {
        String token;
        try {
            token = Files.readString(tokenFile, UTF_8).trim();
        }
        catch (IOException e) {
            return failedFuture(new CredentialsProviderException(PROVIDER_NAME, "Failed to read web identity token file %s".formatted(tokenFile), e));
        }
        if (token.isEmpty()) {
            return failedFuture(new CredentialsProviderException(PROVIDER_NAME, "Web identity token file %s is empty".formatted(tokenFile)));
        }

        AssumeRoleWithWebIdentityRequest request = AssumeRoleWithWebIdentityRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(sessionName)
                .webIdentityToken(token)
                .build();

        log.debug("Assuming role %s with web identity token from %s", roleArn, tokenFile);

        CompletableFuture<AssumeRoleWithWebIdentityResponse> call;
        try {
            call = clientConfiguration.delegationClient().assumeRoleWithWebIdentity(request, clientConfiguration.region());
        }
        catch (RuntimeException e) {
            return failedFuture(failure(e));
        }

        CompletableFuture<Credentials> credentials = call.handle((response, throwable) -> {
            if (throwable != null) {
                throw failure(throwable);
            }
            if (response == null || response.credentials() == null) {
                throw new CredentialsProviderException(PROVIDER_NAME, "Assuming role %s with web identity returned no credentials".formatted(roleArn));
            }
            return fromStsCredentials(response.credentials(), PROVIDER_NAME);
        });
        return forwardCancellation(credentials, call);
    }

    private RuntimeException failure(Throwable throwable)
    {
        Throwable cause = unwrapCompletion(throwable);
        if (cause instanceof CancellationException cancellationException) {
            return cancellationException;
        }
        return new CredentialsProviderException(PROVIDER_NAME, "Failed to assume role %s with web identity".formatted(roleArn), cause);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("roleArn", roleArn)
                .add("tokenFile", tokenFile)
                .add("sessionName", sessionName)
                .toString();
    }
}
