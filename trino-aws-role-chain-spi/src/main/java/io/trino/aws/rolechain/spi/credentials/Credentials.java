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
package io.trino.aws.rolechain.spi.credentials;

import java.time.Instant;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * A set of AWS credentials produced either by a base provider or by a role
 * assumption. {@code providerName} identifies the provider that produced
 * the credentials and is used to attribute failures.
 */
public record Credentials(String accessKeyId, String secretAccessKey, Optional<String> sessionToken, Optional<Instant> expiration, String providerName)
{
    public Credentials
    {
        requireNonNull(accessKeyId, "accessKeyId is null");
        requireNonNull(secretAccessKey, "secretAccessKey is null");
        requireNonNull(sessionToken, "sessionToken is null");
        requireNonNull(expiration, "expiration is null");
        requireNonNull(providerName, "providerName is null");
    }

    public static Credentials build(String accessKeyId, String secretAccessKey, String providerName)
    {
        return new Credentials(accessKeyId, secretAccessKey, Optional.empty(), Optional.empty(), providerName);
    }

    public static Credentials build(String accessKeyId, String secretAccessKey, String sessionToken, Instant expiration, String providerName)
    {
        return new Credentials(accessKeyId, secretAccessKey, Optional.of(sessionToken), Optional.of(expiration), providerName);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("accessKeyId", accessKeyId)
                .add("secretAccessKey", "<redacted>")
                .add("sessionToken", sessionToken.map(ignored -> "<redacted>").orElse("<none>"))
                .add("expiration", expiration.map(Instant::toString).orElse("<never>"))
                .add("providerName", providerName)
                .toString();
    }
}
