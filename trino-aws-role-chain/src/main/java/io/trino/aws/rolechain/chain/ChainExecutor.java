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
package io.trino.aws.rolechain.chain;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.trino.aws.rolechain.spi.credentials.Credentials;
import io.trino.aws.rolechain.spi.exception.CredentialsProviderException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static io.trino.aws.rolechain.chain.Failures.unwrapCompletion;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Runs a {@link ResolvedChain}: loads the base credentials, then assumes every role
 * in order, each hop calling STS with the credentials returned by the previous one.
 * Hops never overlap. The first failure ends the execution and no partial credentials
 * are returned. Cancelling the returned future cancels the call in flight and stops
 * the chain.
 */
public class ChainExecutor
{
    private static final Logger log = Logger.get(ChainExecutor.class);

    private final ClientConfiguration clientConfiguration;

    @Inject
    public ChainExecutor(ClientConfiguration clientConfiguration)
    {
        this.clientConfiguration = requireNonNull(clientConfiguration, "clientConfiguration is null");
    }

    public CompletableFuture<Credentials> execute(ResolvedChain chain)
    {
        requireNonNull(chain, "chain is null");
        return new Execution(chain).start();
    }

    private final class Execution
    {
        private final ResolvedChain chain;
        private final CompletableFuture<Credentials> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<Credentials>> inFlight = new AtomicReference<>();

        private Execution(ResolvedChain chain)
        {
            this.chain = requireNonNull(chain, "chain is null");
        }

        private CompletableFuture<Credentials> start()
        {
            result.whenComplete((credentials, throwable) -> {
                if (result.isCancelled()) {
                    CompletableFuture<Credentials> call = inFlight.get();
                    if (call != null) {
                        call.cancel(true);
                    }
                }
            });

            CompletableFuture<Credentials> current = supplyBase();
            List<DelegationHop> hops = chain.hops();
            for (int index = 0; index < hops.size(); index++) {
                DelegationHop hop = hops.get(index);
                int position = index + 1;
                current = current.thenCompose(caller -> {
                    if (result.isDone()) {
                        throw new CancellationException("Chain execution stopped before hop %s of %s".formatted(position, hops.size()));
                    }
                    return track(hop.execute(caller, clientConfiguration))
                            .handle((credentials, throwable) -> {
                                if (throwable != null) {
                                    throw hopFailure(hop, position, hops.size(), throwable);
                                }
                                return credentials;
                            });
                });
            }

            current.whenComplete((credentials, throwable) -> {
                if (throwable != null) {
                    result.completeExceptionally(unwrapCompletion(throwable));
                    return;
                }
                credentials.expiration().ifPresent(expiration -> log.debug("Chain of %s hops produced credentials from %s expiring at %s",
                        hops.size(), credentials.providerName(), expiration));
                result.complete(credentials);
            });
            return result;
        }

        private CompletableFuture<Credentials> supplyBase()
        {
            CompletableFuture<Credentials> base;
            try {
                base = track(chain.base().supplyCredentials());
            }
            catch (RuntimeException e) {
                return failedFuture(baseFailure(e));
            }
            return base.handle((credentials, throwable) -> {
                if (throwable != null) {
                    throw baseFailure(throwable);
                }
                return credentials;
            });
        }

        private CompletableFuture<Credentials> track(CompletableFuture<Credentials> call)
        {
            inFlight.set(call);
            if (result.isCancelled()) {
                call.cancel(true);
            }
            return call;
        }

        private RuntimeException baseFailure(Throwable throwable)
        {
            Throwable cause = unwrapCompletion(throwable);
            if (cause instanceof CancellationException cancellationException) {
                return cancellationException;
            }
            if (cause instanceof CredentialsProviderException credentialsProviderException) {
                return credentialsProviderException;
            }
            String providerName = chain.base().getClass().getSimpleName();
            return new CredentialsProviderException(providerName, "Failed to load base credentials from %s".formatted(providerName), cause);
        }

        private RuntimeException hopFailure(DelegationHop hop, int position, int hopCount, Throwable throwable)
        {
            Throwable cause = unwrapCompletion(throwable);
            if (cause instanceof CancellationException cancellationException) {
                return cancellationException;
            }
            log.debug(cause, "Assuming role %s failed at hop %s of %s", hop.roleArn(), position, hopCount);
            String providerName = (cause instanceof CredentialsProviderException credentialsProviderException)
                    ? credentialsProviderException.providerName()
                    : DelegationHop.PROVIDER_NAME;
            return new CredentialsProviderException(
                    providerName,
                    "Failed to assume role %s at hop %s of %s".formatted(hop.roleArn(), position, hopCount),
                    cause);
        }
    }
}
