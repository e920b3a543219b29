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
package io.trino.aws.rolechain.sdk;

import io.trino.aws.rolechain.spi.credentials.Credentials;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public final class SdkCredentials
{
    private SdkCredentials() {}

    public static AwsCredentials toAwsCredentials(Credentials credentials)
    {
        return credentials.sessionToken()
                .map(sessionToken -> {
                    AwsSessionCredentials.Builder builder = AwsSessionCredentials.builder()
                            .accessKeyId(credentials.accessKeyId())
                            .secretAccessKey(credentials.secretAccessKey())
                            .sessionToken(sessionToken);
                    credentials.expiration().ifPresent(builder::expirationTime);
                    return (AwsCredentials) builder.build();
                })
                .orElseGet(() -> AwsBasicCredentials.create(credentials.accessKeyId(), credentials.secretAccessKey()));
    }

    public static Credentials fromAwsCredentials(AwsCredentials awsCredentials, String providerName)
    {
        requireNonNull(awsCredentials, "awsCredentials is null");
        Optional<String> sessionToken = (awsCredentials instanceof AwsSessionCredentials sessionCredentials)
                ? Optional.of(sessionCredentials.sessionToken())
                : Optional.empty();
        return new Credentials(awsCredentials.accessKeyId(), awsCredentials.secretAccessKey(), sessionToken, awsCredentials.expirationTime(), providerName);
    }

    public static Credentials fromStsCredentials(software.amazon.awssdk.services.sts.model.Credentials stsCredentials, String providerName)
    {
        requireNonNull(stsCredentials, "stsCredentials is null");
        return new Credentials(
                stsCredentials.accessKeyId(),
                stsCredentials.secretAccessKey(),
                Optional.ofNullable(stsCredentials.sessionToken()),
                Optional.ofNullable(stsCredentials.expiration()),
                providerName);
    }
}
