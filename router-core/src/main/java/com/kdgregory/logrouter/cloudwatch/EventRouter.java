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

import java.util.Iterator;

import com.kdgregory.logrouter.common.LifecycleEvent;
import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.common.util.InternalLogger;


/**
 *  The entry point for the host: translates lifecycle notifications into registry
 *  changes, and validates log events before handing them to the registry.
 *  <p>
 *  None of these methods throw because of a remote failure; those are logged by
 *  the registry and recorded in statistics.
 */
public class EventRouter
{
    private BatchRegistry registry;
    private NameResolver nameResolver;
    private CloudWatchRouterConfig config;
    private CloudWatchRouterStatistics stats;
    private InternalLogger logger;


    public EventRouter(BatchRegistry registry, NameResolver nameResolver, CloudWatchRouterConfig config,
                       CloudWatchRouterStatistics stats, InternalLogger logger)
    {
        this.registry = registry;
        this.nameResolver = nameResolver;
        this.config = config;
        this.stats = stats;
        this.logger = logger;
    }

//----------------------------------------------------------------------------
//  Host API
//----------------------------------------------------------------------------

    /**
     *  Starts a source, using the name resolver to pick its destination.
     */
    public void start(String sourceId)
    {
        Destination dest = nameResolver.resolve(sourceId);
        start(sourceId, dest.getLogGroupName(), dest.getLogStreamName());
    }


    /**
     *  Starts a source with an explicit destination.
     */
    public void start(String sourceId, String logGroupName, String logStreamName)
    {
        registry.start(sourceId, logGroupName, logStreamName);
    }


    /**
     *  Stops a source, sending any pending events.
     */
    public void stop(String sourceId)
    {
        registry.stop(sourceId);
    }


    /**
     *  Routes a single event to its source's batch. Returns <code>true</code> if
     *  the event was accepted (possibly after truncation), <code>false</code> if
     *  it was discarded.
     */
    public boolean handleEvent(String sourceId, LogEvent event)
    {
        if (event.size() == 0)
        {
            logger.warn("discarded empty message from source " + sourceId);
            return false;
        }

        if (event.size() > CloudWatchConstants.MAX_MESSAGE_SIZE)
        {
            stats.incrementOversizeMessages();
            if (config.getTruncateOversizeMessages())
            {
                logger.warn("truncated oversize message from source " + sourceId
                            + " (" + event.size() + " bytes to " + CloudWatchConstants.MAX_MESSAGE_SIZE + ")");
                event.truncate(CloudWatchConstants.MAX_MESSAGE_SIZE);
            }
            else
            {
                logger.warn("discarded oversize message from source " + sourceId
                            + " (" + event.size() + " bytes, limit is " + CloudWatchConstants.MAX_MESSAGE_SIZE + ")");
                stats.updateEventsDropped(1);
                return false;
            }
        }

        return registry.append(sourceId, event);
    }


    /**
     *  Applies a lifecycle notification. Anything thrown while doing so is logged,
     *  so that a single bad notification doesn't stop the caller's loop.
     */
    public void onLifecycleEvent(LifecycleEvent event)
    {
        try
        {
            switch (event.getKind())
            {
                case STARTED:
                    start(event.getSourceId());
                    break;
                case STOPPED:
                    stop(event.getSourceId());
                    break;
                default:
                    logger.warn("unknown lifecycle event: " + event);
            }
        }
        catch (RuntimeException ex)
        {
            logger.error("failed to process " + event, ex);
        }
    }

//----------------------------------------------------------------------------
//  Stream consumers
//----------------------------------------------------------------------------

    /**
     *  Applies lifecycle notifications until the iterator is exhausted or the
     *  calling thread is interrupted. Returns the number of notifications applied.
     */
    public int consumeLifecycleEvents(Iterator<LifecycleEvent> events)
    {
        int count = 0;
        while (! Thread.currentThread().isInterrupted() && events.hasNext())
        {
            onLifecycleEvent(events.next());
            count++;
        }
        return count;
    }


    /**
     *  Routes a source's log events until the iterator is exhausted or the calling
     *  thread is interrupted. Returns the number of events accepted.
     */
    public int consumeLogEvents(String sourceId, Iterator<LogEvent> events)
    {
        int count = 0;
        while (! Thread.currentThread().isInterrupted() && events.hasNext())
        {
            if (handleEvent(sourceId, events.next()))
                count++;
        }
        return count;
    }
}
