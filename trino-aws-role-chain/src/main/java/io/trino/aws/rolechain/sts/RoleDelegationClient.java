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

import io.trino.aws.rolechain.spi.credentials.Credentials;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityResponse;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Remote calls to the AWS Security Token Service. Every call is a single round
 * trip; implementations must not retry.
 */
public interface RoleDelegationClient
{
    /**
     * Assume a role, signing the request as {@code caller}.
     */
    CompletableFuture<AssumeRoleResponse> assumeRole(AssumeRoleRequest request, Credentials caller, Optional<Region> region);

    /**
     * Exchange a web identity token for role credentials. The request is not signed.
     */
    CompletableFuture<AssumeRoleWithWebIdentityResponse> assumeRoleWithWebIdentity(AssumeRoleWithWebIdentityRequest request, Optional<Region> region);
}
