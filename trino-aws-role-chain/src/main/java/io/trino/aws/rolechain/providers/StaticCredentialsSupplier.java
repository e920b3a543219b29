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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

public class StaticCredentialsSupplier
        implements CredentialsSupplier
{
    public static final String PROVIDER_NAME = "StaticCredentials";

    private final Credentials credentials;

    public StaticCredentialsSupplier(String accessKeyId, String secretAccessKey, Optional<String> sessionToken)
    {
        requireNonNull(sessionToken, "sessionToken is null");
        this.credentials = new Credentials(accessKeyId, secretAccessKey, sessionToken, Optional.empty(), PROVIDER_NAME);
    }

    @Override
    public CompletableFuture<Credentials> supplyCredentials()
    {
        return completedFuture(credentials);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("accessKeyId", credentials.accessKeyId())
                .toString();
    }
}
