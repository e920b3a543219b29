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
package io.trino.aws.rolechain.providers;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import static com.google.common.util.concurrent.MoreExecutors.shutdownAndAwaitTermination;
import static java.util.concurrent.Executors.newCachedThreadPool;

/**
 * Threads on which blocking AWS SDK credentials providers are resolved.
 */
public class NamedProviderExecutor
{
    private final ExecutorService executorService = newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("role-chain-named-provider-%s")
            .setDaemon(true)
            .build());

    public Executor executor()
    {
        return executorService;
    }

    public boolean isShutdown()
    {
        return executorService.isShutdown();
    }

    @PreDestroy
    public void shutdown()
    {
        shutdownAndAwaitTermination(executorService, Duration.ofSeconds(30));
    }
}
