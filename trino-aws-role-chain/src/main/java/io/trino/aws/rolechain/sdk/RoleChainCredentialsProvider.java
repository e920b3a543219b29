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

import io.trino.aws.rolechain.chain.ChainExecutor;
import io.trino.aws.rolechain.chain.ResolvedChain;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.trino.aws.rolechain.chain.Failures.unwrapCompletion;
import static io.trino.aws.rolechain.sdk.SdkCredentials.toAwsCredentials;
import static java.util.Objects.requireNonNull;

/**
 * Exposes a resolved chain to AWS SDK clients. Every call runs the whole chain;
 * wrap it in a caching provider if credentials should be reused.
 */
public class RoleChainCredentialsProvider
        implements AwsCredentialsProvider
{
    private final ChainExecutor chainExecutor;
    private final ResolvedChain chain;

    public RoleChainCredentialsProvider(ChainExecutor chainExecutor, ResolvedChain chain)
    {
        this.chainExecutor = requireNonNull(chainExecutor, "chainExecutor is null");
        this.chain = requireNonNull(chain, "chain is null");
    }

    @Override
    public AwsCredentials resolveCredentials()
    {
        Credentials credentials;
        try {
            credentials = chainExecutor.execute(chain).join();
        }
        catch (CompletionException | CancellationException e) {
            Throwable cause = unwrapCompletion(e);
            throw SdkClientException.builder()
                    .message("Unable to load credentials from role chain: " + cause.getMessage())
                    .cause(cause)
                    .build();
        }
        return toAwsCredentials(credentials);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("chain", chain)
                .toString();
    }
}
