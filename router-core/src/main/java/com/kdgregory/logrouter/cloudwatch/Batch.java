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
import java.util.Collections;
import java.util.List;

import com.kdgregory.logrouter.common.LogEvent;


/**
 *  Accumulates the pending events for a single destination, along with the
 *  sequence token that the next write to that destination must use.
 *  <p>
 *  Events are kept in the order that they were appended. The batch never holds
 *  more than {@link CloudWatchConstants#MAX_BATCH_COUNT} events or more than
 *  {@link CloudWatchConstants#MAX_BATCH_BYTES} bytes (as the service counts them).
 *  <p>
 *  All access to the event list, byte count, and token happens while holding
 *  the batch's monitor. Instances are owned by {@link BatchRegistry}, which never
 *  lets a reference escape.
 */
public class Batch
{
    private final String logGroupName;
    private final String logStreamName;

    private String sequenceToken;
    private List<LogEvent> events = new ArrayList<LogEvent>();
    private int byteCount;


    public Batch(String logGroupName, String logStreamName, String sequenceToken)
    {
        this.logGroupName = logGroupName;
        this.logStreamName = logStreamName;
        this.sequenceToken = (sequenceToken == null) ? CloudWatchConstants.EMPTY_TOKEN : sequenceToken;
    }

//----------------------------------------------------------------------------
//  Accessors
//----------------------------------------------------------------------------

    public String getLogGroupName()
    {
        return logGroupName;
    }


    public String getLogStreamName()
    {
        return logStreamName;
    }


    /**
     *  Returns "group/stream", for log messages.
     */
    public String getDestination()
    {
        return logGroupName + "/" + logStreamName;
    }


    public synchronized String getSequenceToken()
    {
        return sequenceToken;
    }


    /**
     *  Replaces the token. This is used when a write was rejected and the current
     *  token has been retrieved from the service; the pending events are retained.
     */
    public synchronized void setSequenceToken(String value)
    {
        sequenceToken = (value == null) ? CloudWatchConstants.EMPTY_TOKEN : value;
    }


    public synchronized int size()
    {
        return events.size();
    }


    /**
     *  Returns the number of bytes that the service will count for this batch.
     */
    public synchronized int byteCount()
    {
        return byteCount;
    }


    public synchronized boolean isEmpty()
    {
        return events.isEmpty();
    }


    /**
     *  Returns an unmodifiable copy of the pending events.
     */
    public synchronized List<LogEvent> getEvents()
    {
        return Collections.unmodifiableList(new ArrayList<LogEvent>(events));
    }

//----------------------------------------------------------------------------
//  Operations
//----------------------------------------------------------------------------

    /**
     *  Determines whether the event can be added without exceeding either the
     *  count or byte limit. Does not change the batch.
     */
    public synchronized boolean accepts(LogEvent event)
    {
        int newByteCount = byteCount + CloudWatchConstants.effectiveSize(event.size());
        return (events.size() < CloudWatchConstants.MAX_BATCH_COUNT)
            && (newByteCount <= CloudWatchConstants.MAX_BATCH_BYTES);
    }


    /**
     *  Adds an event to the end of the batch. The caller must have verified that
     *  the batch {@link #accepts} the event, and must hold the registry lock so
     *  that the two calls aren't separated by another thread's append.
     *
     *  @throws IllegalStateException if the event would exceed the batch limits.
     */
    public synchronized void append(LogEvent event)
    {
        if (! accepts(event))
            throw new IllegalStateException("event does not fit in batch for " + getDestination()
                                            + " (" + events.size() + " events, " + byteCount + " bytes)");

        events.add(event);
        byteCount += CloudWatchConstants.effectiveSize(event.size());
    }


    /**
     *  Creates the batch that replaces this one after a successful write: same
     *  destination, no events, and the token returned by the write.
     */
    public Batch successor(String nextSequenceToken)
    {
        return new Batch(logGroupName, logStreamName, nextSequenceToken);
    }


    @Override
    public synchronized String toString()
    {
        return "Batch[" + getDestination() + ", " + events.size() + " events, " + byteCount + " bytes]";
    }
}
