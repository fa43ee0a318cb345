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
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;


/**
 *  Operational statistics for a router. Counters are updated from the host's
 *  threads and the sweeper thread, and read via JMX, so they are either atomic
 *  or volatile.
 *  <p>
 *  Statistics are limited to primitives, strings, and dates so that they can be
 *  exposed as an MXBean.
 */
public class CloudWatchRouterStatistics
implements CloudWatchRouterStatisticsMXBean
{
    private volatile int activeSources;

    private AtomicLong eventsAccepted = new AtomicLong();
    private AtomicLong eventsDropped = new AtomicLong();
    private AtomicLong unroutableEvents = new AtomicLong();
    private AtomicLong oversizeMessages = new AtomicLong();
    private AtomicLong batchesSent = new AtomicLong();
    private AtomicLong eventsSent = new AtomicLong();
    private AtomicLong failedFlushes = new AtomicLong();
    private AtomicLong tokenRefreshes = new AtomicLong();
    private AtomicLong provisioningFailures = new AtomicLong();
    private AtomicLong throttledWrites = new AtomicLong();

    private volatile Throwable lastError;
    private volatile String lastErrorMessage;
    private volatile Date lastErrorTimestamp;
    private volatile List<String> lastErrorStacktrace;


    /**
     *  Sets the last error. Either the message or the throwable may be null (but
     *  not both).
     *  <p>
     *  If errors happen in rapid succession an observer may see a mix of values
     *  from different errors.
     */
    public void setLastError(String message, Throwable error)
    {
        lastErrorTimestamp = new Date();
        lastError = error;
        lastErrorMessage = (message != null) ? message : error.toString();

        if (error != null)
        {
            List<String> stacktrace = new ArrayList<String>();
            for (StackTraceElement ste : error.getStackTrace())
            {
                stacktrace.add(ste.toString());
            }
            lastErrorStacktrace = stacktrace;
        }
        else
        {
            lastErrorStacktrace = null;
        }
    }


    public Throwable getLastError()
    {
        return lastError;
    }


    @Override
    public String getLastErrorMessage()
    {
        return lastErrorMessage;
    }


    @Override
    public Date getLastErrorTimestamp()
    {
        return lastErrorTimestamp;
    }


    @Override
    public List<String> getLastErrorStacktrace()
    {
        return lastErrorStacktrace;
    }


    @Override
    public int getActiveSources()
    {
        return activeSources;
    }


    public void setActiveSources(int value)
    {
        activeSources = value;
    }


    @Override
    public long getEventsAccepted()
    {
        return eventsAccepted.get();
    }


    public void incrementEventsAccepted()
    {
        eventsAccepted.incrementAndGet();
    }


    @Override
    public long getEventsDropped()
    {
        return eventsDropped.get();
    }


    public void updateEventsDropped(int count)
    {
        eventsDropped.addAndGet(count);
    }


    @Override
    public long getUnroutableEvents()
    {
        return unroutableEvents.get();
    }


    public void incrementUnroutableEvents()
    {
        unroutableEvents.incrementAndGet();
    }


    @Override
    public long getOversizeMessages()
    {
        return oversizeMessages.get();
    }


    public void incrementOversizeMessages()
    {
        oversizeMessages.incrementAndGet();
    }


    @Override
    public long getBatchesSent()
    {
        return batchesSent.get();
    }


    @Override
    public long getEventsSent()
    {
        return eventsSent.get();
    }


    /**
     *  Records a successful submission of the given number of events.
     */
    public void updateBatchSent(int eventCount)
    {
        batchesSent.incrementAndGet();
        eventsSent.addAndGet(eventCount);
    }


    @Override
    public long getFailedFlushes()
    {
        return failedFlushes.get();
    }


    public void incrementFailedFlushes()
    {
        failedFlushes.incrementAndGet();
    }


    @Override
    public long getTokenRefreshes()
    {
        return tokenRefreshes.get();
    }


    public void incrementTokenRefreshes()
    {
        tokenRefreshes.incrementAndGet();
    }


    @Override
    public long getProvisioningFailures()
    {
        return provisioningFailures.get();
    }


    public void incrementProvisioningFailures()
    {
        provisioningFailures.incrementAndGet();
    }


    @Override
    public long getThrottledWrites()
    {
        return throttledWrites.get();
    }


    public void incrementThrottledWrites()
    {
        throttledWrites.incrementAndGet();
    }
}
