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

import com.kdgregory.logrouter.common.internal.Utils;


/**
 *  Sends every source to the same log group, with one stream per source. The
 *  stream name is the source ID with a fixed prefix.
 *  <p>
 *  When not configured, the group is <code>logspout-HOSTNAME</code> and the
 *  prefix is <code>HOSTNAME-</code>.
 */
public class DefaultNameResolver
implements NameResolver
{
    private String logGroupName;
    private String logStreamPrefix;


    public DefaultNameResolver(String logGroupName, String logStreamPrefix)
    {
        this.logGroupName = logGroupName;
        this.logStreamPrefix = logStreamPrefix;
    }


    /**
     *  Creates an instance from configuration, filling in hostname-based defaults.
     */
    public static DefaultNameResolver fromConfig(CloudWatchRouterConfig config)
    {
        String hostname = Utils.hostname();
        String logGroupName = Utils.isBlank(config.getLogGroupName())
                            ? "logspout-" + hostname
                            : config.getLogGroupName();
        String logStreamPrefix = (config.getLogStreamPrefix() == null)
                               ? hostname + "-"
                               : config.getLogStreamPrefix();
        return new DefaultNameResolver(logGroupName, logStreamPrefix);
    }


    @Override
    public Destination resolve(String sourceId)
    {
        return new Destination(logGroupName, logStreamPrefix + sourceId);
    }
}
