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
package io.trino.aws.rolechain;

import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.multibindings.ProvidesIntoMap;
import com.google.inject.multibindings.StringMapKey;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.trino.aws.rolechain.chain.ChainBuilder;
import io.trino.aws.rolechain.chain.ChainExecutor;
import io.trino.aws.rolechain.chain.ClientConfiguration;
import io.trino.aws.rolechain.chain.SessionNameGenerator;
import io.trino.aws.rolechain.chain.TimestampSessionNameGenerator;
import io.trino.aws.rolechain.providers.NamedProviderExecutor;
import io.trino.aws.rolechain.providers.SdkCredentialsSupplier;
import io.trino.aws.rolechain.registry.NamedProviderRegistry;
import io.trino.aws.rolechain.spi.credentials.CredentialsSupplier;
import io.trino.aws.rolechain.sts.RoleDelegationClient;
import io.trino.aws.rolechain.sts.StsRoleDelegationClient;
import software.amazon.awssdk.auth.credentials.ContainerCredentialsProvider;
import software.amazon.awssdk.auth.credentials.EnvironmentVariableCredentialsProvider;
import software.amazon.awssdk.auth.credentials.InstanceProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;

import java.time.Clock;
import java.util.Map;

import static com.google.inject.multibindings.MapBinder.newMapBinder;
import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConfigBinder.configBinder;

public class RoleChainModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(RoleChainModule.class);

    // names a profile's credential_source can reference
    public static final String ENVIRONMENT_PROVIDER = "Environment";
    public static final String EC2_INSTANCE_METADATA_PROVIDER = "Ec2InstanceMetadata";
    public static final String ECS_CONTAINER_PROVIDER = "EcsContainer";

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(RoleChainConfig.class);

        newMapBinder(binder, String.class, CredentialsSupplier.class);

        newOptionalBinder(binder, SessionNameGenerator.class).setDefault().toProvider(() -> {
            log.info("Using default %s implementation", TimestampSessionNameGenerator.class.getSimpleName());
            return new TimestampSessionNameGenerator(Clock.systemUTC());
        });

        newOptionalBinder(binder, RoleDelegationClient.class).setDefault().to(StsRoleDelegationClient.class).in(Scopes.SINGLETON);

        binder.bind(NamedProviderExecutor.class).in(Scopes.SINGLETON);
        binder.bind(ChainBuilder.class).in(Scopes.SINGLETON);
        binder.bind(ChainExecutor.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public ClientConfiguration clientConfiguration(RoleDelegationClient delegationClient, RoleChainConfig config)
    {
        return new ClientConfiguration(delegationClient, config.getRegion().map(Region::of));
    }

    @Provides
    @Singleton
    public NamedProviderRegistry namedProviderRegistry(Map<String, CredentialsSupplier> providers)
    {
        NamedProviderRegistry registry = new NamedProviderRegistry(providers);
        log.info("Named credentials providers: %s", registry.names());
        return registry;
    }

    @ProvidesIntoMap
    @StringMapKey(ENVIRONMENT_PROVIDER)
    @Singleton
    public CredentialsSupplier environmentProvider(NamedProviderExecutor executor)
    {
        return new SdkCredentialsSupplier(ENVIRONMENT_PROVIDER, EnvironmentVariableCredentialsProvider.create(), executor.executor());
    }

    @ProvidesIntoMap
    @StringMapKey(EC2_INSTANCE_METADATA_PROVIDER)
    @Singleton
    public CredentialsSupplier ec2InstanceMetadataProvider(NamedProviderExecutor executor)
    {
        return new SdkCredentialsSupplier(EC2_INSTANCE_METADATA_PROVIDER, InstanceProfileCredentialsProvider.create(), executor.executor());
    }

    @ProvidesIntoMap
    @StringMapKey(ECS_CONTAINER_PROVIDER)
    @Singleton
    public CredentialsSupplier ecsContainerProvider(NamedProviderExecutor executor)
    {
        return new SdkCredentialsSupplier(ECS_CONTAINER_PROVIDER, ContainerCredentialsProvider.builder().build(), executor.executor());
    }
}
