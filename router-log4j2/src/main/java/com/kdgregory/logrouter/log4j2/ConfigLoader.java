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

package com.kdgregory.logrouter.log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;

import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterConfig;
import com.kdgregory.logrouter.common.internal.Utils;


/**
 *  Builds router configuration from environment variables and system properties.
 *  Each setting has an environment variable name (eg, <code>LOGROUTER_GROUP</code>);
 *  the corresponding system property is that name in lowercase, with underscores
 *  replaced by dots (eg, <code>logrouter.group</code>). If both are present, the
 *  system property wins. Settings that are present in neither keep their defaults.
 *  <p>
 *  Values are converted when loaded; a value that can't be converted is reported
 *  by {@link #load} as an <code>IllegalArgumentException</code>, along with any
 *  other unconvertible values. Semantic validation is left to
 *  {@link CloudWatchRouterConfig#validate}.
 */
public class ConfigLoader
{
    public final static String LOG_GROUP                = "LOGROUTER_GROUP";
    public final static String LOG_STREAM_PREFIX        = "LOGROUTER_STREAM_PREFIX";
    public final static String RETENTION_PERIOD         = "LOGROUTER_RETENTION";
    public final static String SWEEP_INTERVAL           = "LOGROUTER_SWEEP_INTERVAL";
    public final static String INITIALIZATION_TIMEOUT   = "LOGROUTER_INIT_TIMEOUT";
    public final static String SEND_TIMEOUT             = "LOGROUTER_SEND_TIMEOUT";
    public final static String TRUNCATE_OVERSIZE        = "LOGROUTER_TRUNCATE_OVERSIZE";
    public final static String CLIENT_FACTORY           = "LOGROUTER_CLIENT_FACTORY";
    public final static String CLIENT_REGION            = "AWS_REGION";
    public final static String CLIENT_ENDPOINT          = "LOGROUTER_ENDPOINT";
    public final static String USE_SHUTDOWN_HOOK        = "LOGROUTER_SHUTDOWN_HOOK";

    private Function<String,String> environment;
    private Properties systemProperties;

    private List<String> errors = new ArrayList<>();


    /**
     *  Creates an instance that reads the process environment and JVM system properties.
     */
    public ConfigLoader()
    {
        this(System::getenv, System.getProperties());
    }


    /**
     *  Creates an instance with explicit sources. Exposed for testing.
     */
    public ConfigLoader(Function<String,String> environment, Properties systemProperties)
    {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }


    /**
     *  Loads configuration.
     *
     *  @throws IllegalArgumentException if any value can't be converted.
     */
    public CloudWatchRouterConfig load()
    {
        errors.clear();
        CloudWatchRouterConfig config = new CloudWatchRouterConfig();

        String logGroupName = lookup(LOG_GROUP);
        if (logGroupName != null)
            config.setLogGroupName(logGroupName);

        String logStreamPrefix = lookup(LOG_STREAM_PREFIX);
        if (logStreamPrefix != null)
            config.setLogStreamPrefix(logStreamPrefix);

        Long retentionPeriod = lookupLong(RETENTION_PERIOD);
        if (retentionPeriod != null)
            config.setRetentionPeriod(Integer.valueOf(retentionPeriod.intValue()));

        Long sweepInterval = lookupLong(SWEEP_INTERVAL);
        if (sweepInterval != null)
            config.setSweepInterval(sweepInterval.longValue());

        Long initializationTimeout = lookupLong(INITIALIZATION_TIMEOUT);
        if (initializationTimeout != null)
            config.setInitializationTimeout(initializationTimeout.longValue());

        Long sendTimeout = lookupLong(SEND_TIMEOUT);
        if (sendTimeout != null)
            config.setSendTimeout(sendTimeout.longValue());

        Boolean truncateOversize = lookupBoolean(TRUNCATE_OVERSIZE);
        if (truncateOversize != null)
            config.setTruncateOversizeMessages(truncateOversize.booleanValue());

        Boolean useShutdownHook = lookupBoolean(USE_SHUTDOWN_HOOK);
        if (useShutdownHook != null)
            config.setUseShutdownHook(useShutdownHook.booleanValue());

        config.setClientFactoryMethod(lookup(CLIENT_FACTORY));
        config.setClientRegion(lookup(CLIENT_REGION));
        config.setClientEndpoint(lookup(CLIENT_ENDPOINT));

        if (! errors.isEmpty())
        {
            throw new IllegalArgumentException("invalid configuration: " + String.join(", ", errors));
        }

        return config;
    }


    /**
     *  Returns the system property name that corresponds to an environment variable.
     */
    public static String toPropertyName(String envName)
    {
        return envName.toLowerCase().replace('_', '.');
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Returns the value for a setting, null if it isn't set (or is blank).
     */
    private String lookup(String envName)
    {
        String value = systemProperties.getProperty(toPropertyName(envName));
        if (Utils.isBlank(value))
            value = environment.apply(envName);
        if (Utils.isBlank(value))
            return null;
        return value.trim();
    }


    private Long lookupLong(String envName)
    {
        String value = lookup(envName);
        if (value == null)
            return null;

        try
        {
            return Long.valueOf(value);
        }
        catch (NumberFormatException ex)
        {
            errors.add(envName + " is not a number: " + value);
            return null;
        }
    }


    private Boolean lookupBoolean(String envName)
    {
        String value = lookup(envName);
        if (value == null)
            return null;

        if ("true".equalsIgnoreCase(value))
            return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value))
            return Boolean.FALSE;

        errors.add(envName + " is not true or false: " + value);
        return null;
    }
}
