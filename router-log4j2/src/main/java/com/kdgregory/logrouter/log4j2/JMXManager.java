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

import java.util.HashMap;
import java.util.Map;

import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import javax.management.StandardMBean;

import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterStatistics;
import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterStatisticsMXBean;
import com.kdgregory.logrouter.common.util.InternalLogger;


/**
 *  Registers router statistics beans with an MBeanServer (normally the platform
 *  server). Each bean is registered under the name
 *  <code>com.kdgregory.logrouter:type=CloudWatchRouterStatistics,name=ROUTER</code>.
 *  <p>
 *  Registration failures are logged but not thrown: a router without JMX is still
 *  a working router.
 */
public class JMXManager
{
    public final static String OBJECT_NAME_PREFIX = "com.kdgregory.logrouter:type=CloudWatchRouterStatistics,name=";

    private MBeanServer mbeanServer;
    private InternalLogger logger;

    // protected so that tests can inspect
    protected Map<String,ObjectName> registrations = new HashMap<String,ObjectName>();


    public JMXManager(MBeanServer mbeanServer, InternalLogger logger)
    {
        this.mbeanServer = mbeanServer;
        this.logger = logger;
    }


    /**
     *  Registers a router's statistics bean. Registering the same router name twice
     *  is logged and ignored.
     */
    public synchronized void addStatsBean(String routerName, CloudWatchRouterStatistics statsBean)
    {
        if (registrations.containsKey(routerName))
        {
            logger.warn("JMXManager: statistics already registered for router " + routerName);
            return;
        }

        try
        {
            ObjectName objectName = toObjectName(routerName);
            StandardMBean mbean = new StandardMBean(statsBean, CloudWatchRouterStatisticsMXBean.class, true);
            mbeanServer.registerMBean(mbean, objectName);
            registrations.put(routerName, objectName);
            logger.debug("registered statistics for router " + routerName + " as " + objectName);
        }
        catch (Exception ex)
        {
            logger.error("JMXManager: failed to register statistics for router " + routerName, ex);
        }
    }


    /**
     *  Deregisters a router's statistics bean. Removing a router that was never
     *  registered is a no-op.
     */
    public synchronized void removeStatsBean(String routerName)
    {
        ObjectName objectName = registrations.remove(routerName);
        if (objectName == null)
            return;

        try
        {
            mbeanServer.unregisterMBean(objectName);
        }
        catch (Exception ex)
        {
            logger.error("JMXManager: failed to unregister statistics for router " + routerName, ex);
        }
    }


    /**
     *  Returns the name used to register a router's statistics.
     *
     *  @throws MalformedObjectNameException if the router name contains characters
     *          that aren't valid in an unquoted property value.
     */
    public static ObjectName toObjectName(String routerName)
    throws MalformedObjectNameException
    {
        return new ObjectName(OBJECT_NAME_PREFIX + routerName);
    }
}
