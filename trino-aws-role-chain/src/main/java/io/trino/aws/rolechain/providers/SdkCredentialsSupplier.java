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

import io.trino.aws.rolechain.spi.credentials.Credentials;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;
import io.trino.aws.rolechain.spi.exception.CredentialsProviderException;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.trino.aws.rolechain.sdk.SdkCredentials.fromAwsCredentials;
import static java.util.Objects.requireNonNull;

/**
 * Adapts a blocking AWS SDK credentials provider. Resolution runs on
 * {@code executor} so that callers are never blocked.
 */
public class SdkCredentialsSupplier
        implements CredentialsSupplier
{
    private final String providerName;
    private final AwsCredentialsProvider delegate;
    private final Executor executor;

    public SdkCredentialsSupplier(String providerName, AwsCredentialsProvider delegate, Executor executor)
    {
        this.providerName = requireNonNull(providerName, "providerName is null");
        this.delegate = requireNonNull(delegate, "delegate is null");
        this.executor = requireNonNull(executor, "executor is null");
    }

    @Override
    public CompletableFuture<Credentials> supplyCredentials()
    {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fromAwsCredentials(delegate.resolveCredentials(), providerName);
            }
            catch (SdkException e) {
                throw new CredentialsProviderException(providerName, "Failed to load credentials from %s".formatted(providerName), e);
            }
        }, executor);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("providerName", providerName)
                .add("delegate", delegate.getClass().getSimpleName())
                .toString();
    }
}
