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
package io.trino.aws.rolechain.spi.exception;

import static java.util.Objects.requireNonNull;

/**
 * Loading credentials failed, either in a base provider or while assuming
 * a role. {@link #providerName()} names the provider that failed.
 */
public class CredentialsProviderException
        extends RoleChainException
{
    private final String providerName;

    public CredentialsProviderException(String providerName, String message)
    {
        super(message);
        this.providerName = requireNonNull(providerName, "providerName is null");
    }

    public CredentialsProviderException(String providerName, String message, Throwable cause)
    {
        super(message, requireNonNull(cause, "cause is null"));
        this.providerName = requireNonNull(providerName, "providerName is null");
    }

    public String providerName()
    {
        return providerName;
    }
}
