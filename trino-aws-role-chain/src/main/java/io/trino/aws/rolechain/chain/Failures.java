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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Failures
{
    private Failures() {}

    /**
     * Strip the {@link CompletionException} layers that {@code CompletableFuture}
     * stages add around the original failure.
     */
    public static Throwable unwrapCompletion(Throwable throwable)
    {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Cancelling {@code stage} also cancels {@code upstream}, the remote call it was derived from.
     */
    public static <T> CompletableFuture<T> forwardCancellation(CompletableFuture<T> stage, CompletableFuture<?> upstream)
    {
        stage.whenComplete((value, throwable) -> {
            if (stage.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return stage;
    }
}
