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

import java.util.List;

import com.kdgregory.logrouter.common.LifecycleEvent;
import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.common.util.InternalLogger;
import com.kdgregory.logrouter.common.util.ThreadFactory;
import com.kdgregory.logrouter.facade.CloudWatchFacade;


/**
 *  Assembles the components that ship logs to CloudWatch, and manages their
 *  lifecycle. A host creates one instance, calls {@link #startup}, feeds it
 *  lifecycle notifications and log events, and calls {@link #shutdown} when
 *  done (or lets the shutdown hook do so).
 *  <p>
 *  Typical usage:
 *  <pre>
 *      CloudWatchRouter router = new CloudWatchRouter("example", config, facade, logger, new DefaultThreadFactory("example"));
 *      router.startup();
 *      router.start("container-1");
 *      router.handleEvent("container-1", new LogEvent(System.currentTimeMillis(), "hello, world"));
 *      router.stop("container-1");
 *      router.shutdown();
 *  </pre>
 */
public class CloudWatchRouter
{
    private String name;
    private CloudWatchRouterConfig config;
    private CloudWatchFacade facade;
    private InternalLogger logger;
    private ThreadFactory threadFactory;

    private CloudWatchRouterStatistics stats;
    private BatchRegistry registry;
    private EventRouter eventRouter;
    private Sweeper sweeper;

    private volatile Thread sweeperThread;
    private volatile Thread shutdownHook;
    private volatile boolean isRunning;


    /**
     *  Constructs an instance that uses {@link DefaultNameResolver} for sources
     *  started without an explicit destination.
     */
    public CloudWatchRouter(String name, CloudWatchRouterConfig config, CloudWatchFacade facade,
                            InternalLogger logger, ThreadFactory threadFactory)
    {
        this(name, config, facade, DefaultNameResolver.fromConfig(config), logger, threadFactory);
    }


    /**
     *  Base constructor.
     */
    public CloudWatchRouter(String name, CloudWatchRouterConfig config, CloudWatchFacade facade,
                            NameResolver nameResolver, InternalLogger logger, ThreadFactory threadFactory)
    {
        this.name = name;
        this.config = config;
        this.facade = facade;
        this.logger = logger;
        this.threadFactory = threadFactory;

        stats = new CloudWatchRouterStatistics();
        registry = new BatchRegistry(
                        new FacadeStreamProvisioner(config, facade, logger),
                        new FacadeIngestor(config, facade, stats),
                        stats, logger);
        eventRouter = new EventRouter(registry, nameResolver, config, stats, logger);
        sweeper = new Sweeper(registry, config.getSweepInterval(), logger);
    }

//----------------------------------------------------------------------------
//  Lifecycle
//----------------------------------------------------------------------------

    /**
     *  Validates configuration and starts the sweeper.
     *
     *  @throws IllegalArgumentException if the configuration is invalid.
     */
    public synchronized void startup()
    {
        if (isRunning)
            return;

        List<String> errors = config.validate();
        if (! errors.isEmpty())
        {
            throw new IllegalArgumentException("invalid configuration: " + String.join(", ", errors));
        }

        sweeperThread = threadFactory.startThread(sweeper, "sweeper", (thread, ex) ->
        {
            logger.error("sweeper thread " + thread.getName() + " died", ex);
            stats.setLastError("sweeper thread died", ex);
        });

        optAddShutdownHook();
        isRunning = true;
        logger.debug("router " + name + " started");
    }


    /**
     *  Stops the sweeper, stops every registered source (which sends pending
     *  events), and shuts down the facade. Once shut down, an instance can't be
     *  restarted.
     */
    public synchronized void shutdown()
    {
        if (! isRunning)
            return;

        isRunning = false;
        logger.debug("router " + name + " shutting down");

        sweeper.stop();
        if (! sweeper.waitUntilStopped(config.getSweepInterval() + config.getSendTimeout()))
        {
            logger.warn("sweeper did not stop in time; continuing shutdown");
        }

        registry.stopAll();
        facade.shutdown();
        optRemoveShutdownHook();
        logger.debug("router " + name + " shut down");
    }


    public boolean isRunning()
    {
        return isRunning;
    }

//----------------------------------------------------------------------------
//  Host API
//----------------------------------------------------------------------------

    public void start(String sourceId)
    {
        eventRouter.start(sourceId);
    }


    public void start(String sourceId, String logGroupName, String logStreamName)
    {
        eventRouter.start(sourceId, logGroupName, logStreamName);
    }


    public void stop(String sourceId)
    {
        eventRouter.stop(sourceId);
    }


    public boolean handleEvent(String sourceId, LogEvent event)
    {
        return eventRouter.handleEvent(sourceId, event);
    }


    public void onLifecycleEvent(LifecycleEvent event)
    {
        eventRouter.onLifecycleEvent(event);
    }

//----------------------------------------------------------------------------
//  Accessors
//----------------------------------------------------------------------------

    public String getName()
    {
        return name;
    }


    public CloudWatchRouterConfig getConfig()
    {
        return config;
    }


    public CloudWatchRouterStatistics getStatistics()
    {
        return stats;
    }


    public BatchRegistry getRegistry()
    {
        return registry;
    }


    public EventRouter getEventRouter()
    {
        return eventRouter;
    }


    public Sweeper getSweeper()
    {
        return sweeper;
    }


    /**
     *  Returns the thread running the sweeper; null before startup. Exposed for testing.
     */
    public Thread getSweeperThread()
    {
        return sweeperThread;
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private void optAddShutdownHook()
    {
        if (! config.getUseShutdownHook())
            return;

        shutdownHook = new Thread(new Runnable()
        {
            @Override
            public void run()
            {
                logger.debug("shutdown hook invoked");
                shutdownHook = null;
                CloudWatchRouter.this.shutdown();
            }
        });
        shutdownHook.setName("com-kdgregory-logrouter-" + name + "-shutdownHook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }


    private void optRemoveShutdownHook()
    {
        Thread hook = shutdownHook;
        if (hook == null)
            return;

        try
        {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        catch (IllegalStateException ex)
        {
            logger.debug("unable to remove shutdown hook: JVM is already shutting down");
        }
        finally
        {
            shutdownHook = null;
        }
    }
}
