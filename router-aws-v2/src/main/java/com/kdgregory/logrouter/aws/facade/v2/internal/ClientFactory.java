// Copyright (c) Keith D Gregory
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.kdgregory.logrouter.aws.facade.v2.internal;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.time.Duration;

import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;

import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterConfig;
import com.kdgregory.logrouter.common.internal.Utils;


/**
 *  Creates and configures a CloudWatch Logs client based on the router configuration.
 *  <p>
 *  Every call made by the router happens while it holds a lock, so the client is
 *  always built with timeouts: each attempt is limited to the send timeout, and
 *  the entire call (including SDK retries) to the larger of the two configured
 *  timeouts.
 *  <p>
 *  Implementation note: all internal methods are protected to enable testing.
 */
public class ClientFactory
{
    private CloudWatchRouterConfig config;

    public ClientFactory(CloudWatchRouterConfig config)
    {
        this.config = config;
    }

//----------------------------------------------------------------------------
//  Public methods
//----------------------------------------------------------------------------

    public CloudWatchLogsClient create()
    {
        CloudWatchLogsClient client = tryInstantiateFromFactory();
        if (client != null)
            return client;

        CloudWatchLogsClientBuilder builder = createClientBuilder();
        optSetRegionOrEndpoint(builder);
        builder.overrideConfiguration(createOverrideConfiguration());
        return builder.build();
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Determines whether the configuration specifies a factory method, and
     *  if so tries to invoke it.
     */
    protected CloudWatchLogsClient tryInstantiateFromFactory()
    {
        String fullyQualifiedMethodName = config.getClientFactoryMethod();
        if (Utils.isBlank(fullyQualifiedMethodName))
            return null;

        // there are two variants of the factory method; we'll look for the simple one
        // first, then the one that takes region and endpoint; we separate lookup from
        // invocation because they throw different exceptions
        Method factoryMethod;
        try
        {
            factoryMethod = Utils.findFullyQualifiedMethod(fullyQualifiedMethodName);
        }
        catch (Exception ignored)
        {
            try
            {
                factoryMethod = Utils.findFullyQualifiedMethod(fullyQualifiedMethodName, String.class, String.class);
            }
            catch (Exception ex)
            {
                throw new RuntimeException("invalid factory method: " + fullyQualifiedMethodName, ex);
            }
        }

        try
        {
            return (factoryMethod.getParameterTypes().length == 0)
                 ? CloudWatchLogsClient.class.cast(factoryMethod.invoke(null))
                 : CloudWatchLogsClient.class.cast(factoryMethod.invoke(null, config.getClientRegion(), config.getClientEndpoint()));
        }
        catch (Throwable ex)
        {
            if (ex instanceof InvocationTargetException)
                ex = ex.getCause();

            throw new RuntimeException("exception invoking factory method: " + fullyQualifiedMethodName, ex);
        }
    }


    protected CloudWatchLogsClientBuilder createClientBuilder()
    {
        return CloudWatchLogsClient.builder();
    }


    /**
     *  If the configuration specifies region or endpoint, sets them.
     */
    protected void optSetRegionOrEndpoint(CloudWatchLogsClientBuilder builder)
    {
        String region = config.getClientRegion();
        String endpoint = config.getClientEndpoint();

        if (! Utils.isBlank(endpoint))
        {
            builder.endpointOverride(URI.create(endpoint));
        }
        if (! Utils.isBlank(region))
        {
            builder.region(Region.of(region));
        }
    }


    protected ClientOverrideConfiguration createOverrideConfiguration()
    {
        long callTimeout = Math.max(config.getInitializationTimeout(), config.getSendTimeout());
        return ClientOverrideConfiguration.builder()
               .apiCallAttemptTimeout(Duration.ofMillis(config.getSendTimeout()))
               .apiCallTimeout(Duration.ofMillis(callTimeout))
               .build();
    }
}
