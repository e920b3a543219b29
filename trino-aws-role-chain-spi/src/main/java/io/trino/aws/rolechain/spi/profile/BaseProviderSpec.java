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
package io.trino.aws.rolechain.spi.profile;

import java.nio.file.Path;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Where the first credentials of a chain come from.
 */
public sealed interface BaseProviderSpec
{
    /**
     * Credentials from a provider registered under {@code name}, e.g. {@code Environment}.
     */
    record NamedSource(String name)
            implements BaseProviderSpec
    {
        public NamedSource
        {
            requireNonNull(name, "name is null");
        }
    }

    record StaticKeyPair(String accessKeyId, String secretAccessKey, Optional<String> sessionToken)
            implements BaseProviderSpec
    {
        public StaticKeyPair
        {
            requireNonNull(accessKeyId, "accessKeyId is null");
            requireNonNull(secretAccessKey, "secretAccessKey is null");
            requireNonNull(sessionToken, "sessionToken is null");
        }

        public StaticKeyPair(String accessKeyId, String secretAccessKey)
        {
            this(accessKeyId, secretAccessKey, Optional.empty());
        }

        @Override
        public String toString()
        {
            return toStringHelper(this)
                    .add("accessKeyId", accessKeyId)
                    .add("secretAccessKey", "<redacted>")
                    .add("sessionToken", sessionToken.map(ignored -> "<redacted>").orElse("<none>"))
                    .toString();
        }
    }

    /**
     * Credentials obtained by exchanging the token stored in {@code tokenFile}
     * for a session of {@code roleArn}.
     */
    record WebIdentityTokenRole(String roleArn, Path tokenFile, Optional<String> sessionName)
            implements BaseProviderSpec
    {
        public WebIdentityTokenRole
        {
            requireNonNull(roleArn, "roleArn is null");
            requireNonNull(tokenFile, "tokenFile is null");
            requireNonNull(sessionName, "sessionName is null");
        }
    }
}
