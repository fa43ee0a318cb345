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

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

import javax.management.MBeanServer;

import com.kdgregory.logrouter.aws.facade.v2.CloudWatchFacadeImpl;
import com.kdgregory.logrouter.cloudwatch.CloudWatchRouter;
import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterConfig;
import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.common.util.DefaultThreadFactory;
import com.kdgregory.logrouter.common.util.InternalLogger;
import com.kdgregory.logrouter.facade.CloudWatchFacade;


/**
 *  Wires a {@link CloudWatchRouter} to its production collaborators: the SDK v2
 *  facade, Log4J 2 for internal logging, and the platform MBeanServer for
 *  statistics.
 *  <p>
 *  When run from the command line, this reads configuration from the environment
 *  (see {@link ConfigLoader}) and ships standard input to CloudWatch, one event
 *  per line, as a single source. The source ID is the first argument, "stdin" if
 *  not provided.
 */
public class CloudWatchRouterLauncher
{
    public final static String DEFAULT_ROUTER_NAME = "logrouter";
    public final static String DEFAULT_SOURCE_ID = "stdin";

    private String name;
    private InternalLogger logger;
    private JMXManager jmxManager;
    private CloudWatchRouter router;


    /**
     *  Creates an instance with production collaborators.
     */
    public CloudWatchRouterLauncher(String name, CloudWatchRouterConfig config)
    {
        this(name, config, new CloudWatchFacadeImpl(config), new Log4J2InternalLogger(name),
             ManagementFactory.getPlatformMBeanServer());
    }


    /**
     *  Base constructor, which allows tests to substitute collaborators.
     */
    public CloudWatchRouterLauncher(String name, CloudWatchRouterConfig config, CloudWatchFacade facade,
                                    InternalLogger logger, MBeanServer mbeanServer)
    {
        this.name = name;
        this.logger = logger;
        this.jmxManager = new JMXManager(mbeanServer, logger);
        this.router = new CloudWatchRouter(name, config, facade, logger, new DefaultThreadFactory(name));
    }


    /**
     *  Starts the router and registers its statistics. Returns the router, so
     *  that the caller can feed it events.
     *
     *  @throws IllegalArgumentException if the configuration is invalid.
     */
    public CloudWatchRouter start()
    {
        router.startup();
        jmxManager.addStatsBean(name, router.getStatistics());
        return router;
    }


    /**
     *  Deregisters statistics and shuts down the router, sending all pending events.
     */
    public void stop()
    {
        jmxManager.removeStatsBean(name);
        router.shutdown();
    }


    /**
     *  Reads lines from the provided source until end-of-input, sending each as an
     *  event for the given source. The source is started before reading and stopped
     *  afterward. Returns the number of events accepted.
     */
    public int pipe(String sourceId, Reader in)
    {
        BufferedReader reader = (in instanceof BufferedReader) ? (BufferedReader)in : new BufferedReader(in);
        Iterator<LogEvent> events = reader.lines()
                                    .map(line -> new LogEvent(System.currentTimeMillis(), line))
                                    .iterator();

        router.start(sourceId);
        try
        {
            int count = router.getEventRouter().consumeLogEvents(sourceId, events);
            logger.debug("read " + count + " event(s) for source " + sourceId);
            return count;
        }
        finally
        {
            router.stop(sourceId);
        }
    }


    public CloudWatchRouter getRouter()
    {
        return router;
    }


    public JMXManager getJMXManager()
    {
        return jmxManager;
    }


    public static void main(String[] argv)
    throws Exception
    {
        String sourceId = (argv.length > 0) ? argv[0] : DEFAULT_SOURCE_ID;
        CloudWatchRouterConfig config = new ConfigLoader().load();

        CloudWatchRouterLauncher launcher = new CloudWatchRouterLauncher(DEFAULT_ROUTER_NAME, config);
        launcher.start();
        try
        {
            launcher.pipe(sourceId, new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        finally
        {
            launcher.stop();
        }
    }
}
