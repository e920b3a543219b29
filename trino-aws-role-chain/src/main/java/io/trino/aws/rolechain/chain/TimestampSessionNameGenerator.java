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

import java.time.Clock;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class TimestampSessionNameGenerator
        implements SessionNameGenerator
{
    private final Clock clock;

    public TimestampSessionNameGenerator(Clock clock)
    {
        this.clock = requireNonNull(clock, "clock is null");
    }

    @Override
    public String defaultSessionName(String purpose)
    {
        requireNonNull(purpose, "purpose is null");
        checkArgument(!purpose.isEmpty(), "purpose is empty");
        return "%s-%s".formatted(purpose, clock.millis());
    }
}
