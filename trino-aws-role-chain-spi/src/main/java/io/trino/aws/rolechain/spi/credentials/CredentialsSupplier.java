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

import java.util.concurrent.CompletableFuture;

public interface CredentialsSupplier
{
    /**
     * Load a fresh set of credentials. Failures are reported by completing the
     * returned future exceptionally, preferably with a
     * {@link io.trino.aws.rolechain.spi.exception.CredentialsProviderException}.
     * Implementations may be shared by many chains and must be thread safe.
     */
    CompletableFuture<Credentials> supplyCredentials();
}
