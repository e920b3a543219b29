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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record RoleHopSpec(String roleArn, Optional<String> externalId, Optional<String> sessionName)
{
    public RoleHopSpec
    {
        requireNonNull(roleArn, "roleArn is null");
        requireNonNull(externalId, "externalId is null");
        requireNonNull(sessionName, "sessionName is null");
    }

    public static RoleHopSpec assumeRole(String roleArn)
    {
        return new RoleHopSpec(roleArn, Optional.empty(), Optional.empty());
    }
}
