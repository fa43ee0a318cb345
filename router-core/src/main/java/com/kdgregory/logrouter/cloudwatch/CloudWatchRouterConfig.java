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

package com.kdgregory.logrouter.cloudwatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;


/**
 *  Configuration for {@link CloudWatchRouter}. Setters return the instance, so
 *  that configuration can be chained.
 *  <p>
 *  Note: the timeouts are read on every remote call, so they're volatile.
 */
public class CloudWatchRouterConfig
{
    public final static Integer DEFAULT_RETENTION_PERIOD        = null; // unlimited
    public final static long    DEFAULT_SWEEP_INTERVAL          = CloudWatchConstants.DEFAULT_SWEEP_INTERVAL;
    public final static long    DEFAULT_INITIALIZATION_TIMEOUT  = 60000;
    public final static long    DEFAULT_SEND_TIMEOUT            = 2000;
    public final static boolean DEFAULT_TRUNCATE_OVERSIZE       = true;
    public final static boolean DEFAULT_USE_SHUTDOWN_HOOK       = true;


    private String              logGroupName;
    private String              logStreamPrefix;
    private Integer             retentionPeriod         = DEFAULT_RETENTION_PERIOD;
    private long                sweepInterval           = DEFAULT_SWEEP_INTERVAL;
    private volatile long       initializationTimeout   = DEFAULT_INITIALIZATION_TIMEOUT;
    private volatile long       sendTimeout             = DEFAULT_SEND_TIMEOUT;
    private boolean             truncateOversizeMessages = DEFAULT_TRUNCATE_OVERSIZE;
    private String              clientFactoryMethod;
    private String              clientRegion;
    private String              clientEndpoint;
    private boolean             useShutdownHook         = DEFAULT_USE_SHUTDOWN_HOOK;


    /**
     *  The log group used for sources that are started without an explicit
     *  destination. If null, {@link DefaultNameResolver} derives one from the
     *  hostname.
     */
    public String getLogGroupName()
    {
        return logGroupName;
    }

    public CloudWatchRouterConfig setLogGroupName(String value)
    {
        logGroupName = value;
        return this;
    }


    /**
     *  Prepended to the source ID to form a stream name, for sources that are
     *  started without an explicit destination. If null, {@link DefaultNameResolver}
     *  derives one from the hostname.
     */
    public String getLogStreamPrefix()
    {
        return logStreamPrefix;
    }

    public CloudWatchRouterConfig setLogStreamPrefix(String value)
    {
        logStreamPrefix = value;
        return this;
    }


    /**
     *  Retention period, in days, applied to log groups that the router creates.
     *  Null means that events never expire.
     */
    public Integer getRetentionPeriod()
    {
        return retentionPeriod;
    }

    public CloudWatchRouterConfig setRetentionPeriod(Integer value)
    {
        retentionPeriod = value;
        return this;
    }


    /**
     *  Milliseconds between sweeps.
     */
    public long getSweepInterval()
    {
        return sweepInterval;
    }

    public CloudWatchRouterConfig setSweepInterval(long value)
    {
        sweepInterval = value;
        return this;
    }


    /**
     *  Milliseconds allowed to confirm or create a destination.
     */
    public long getInitializationTimeout()
    {
        return initializationTimeout;
    }

    public CloudWatchRouterConfig setInitializationTimeout(long value)
    {
        initializationTimeout = value;
        return this;
    }


    /**
     *  Milliseconds allowed for a single batch submission, including retries
     *  for throttling.
     */
    public long getSendTimeout()
    {
        return sendTimeout;
    }

    public CloudWatchRouterConfig setSendTimeout(long value)
    {
        sendTimeout = value;
        return this;
    }


    public boolean getTruncateOversizeMessages()
    {
        return truncateOversizeMessages;
    }

    public CloudWatchRouterConfig setTruncateOversizeMessages(boolean value)
    {
        truncateOversizeMessages = value;
        return this;
    }


    public String getClientFactoryMethod()
    {
        return clientFactoryMethod;
    }

    public CloudWatchRouterConfig setClientFactoryMethod(String value)
    {
        clientFactoryMethod = value;
        return this;
    }


    public String getClientRegion()
    {
        return clientRegion;
    }

    public CloudWatchRouterConfig setClientRegion(String value)
    {
        clientRegion = value;
        return this;
    }


    public String getClientEndpoint()
    {
        return clientEndpoint;
    }

    public CloudWatchRouterConfig setClientEndpoint(String value)
    {
        clientEndpoint = value;
        return this;
    }


    public boolean getUseShutdownHook()
    {
        return useShutdownHook;
    }

    public CloudWatchRouterConfig setUseShutdownHook(boolean value)
    {
        useShutdownHook = value;
        return this;
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if ((logGroupName != null) && ! Pattern.matches(CloudWatchConstants.ALLOWED_GROUP_NAME_REGEX, logGroupName))
        {
            result.add("invalid log group name: " + logGroupName);
        }

        if ((logStreamPrefix != null) && (logStreamPrefix.contains(":") || logStreamPrefix.contains("*")))
        {
            result.add("invalid log stream prefix: " + logStreamPrefix);
        }

        try
        {
            CloudWatchConstants.validateRetentionPeriod(retentionPeriod);
        }
        catch (IllegalArgumentException ex)
        {
            result.add(ex.getMessage());
        }

        if (sweepInterval <= 0)
        {
            result.add("sweep interval must be positive: " + sweepInterval);
        }

        if (initializationTimeout <= 0)
        {
            result.add("initialization timeout must be positive: " + initializationTimeout);
        }

        if (sendTimeout <= 0)
        {
            result.add("send timeout must be positive: " + sendTimeout);
        }

        return result;
    }
}
