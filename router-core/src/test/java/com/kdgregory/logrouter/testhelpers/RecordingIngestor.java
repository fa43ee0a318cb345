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

package com.kdgregory.logrouter.testhelpers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.kdgregory.logrouter.cloudwatch.Ingestor;
import com.kdgregory.logrouter.common.LogEvent;


/**
 *  An <code>Ingestor</code> that records every submission and returns tokens
 *  "T1", "T2", and so on. It detects overlapping submissions for the same
 *  destination: if one is seen, {@link #overlapDetected} is set (the failure is
 *  also thrown, but the registry would only log it, so tests must check the flag).
 *  <p>
 *  Override {@link #doSubmit} to simulate failures or slow calls.
 */
public class RecordingIngestor
implements Ingestor
{
    public static class Submission
    {
        public final String destination;
        public final String sequenceToken;
        public final List<LogEvent> events;

        public Submission(String destination, String sequenceToken, List<LogEvent> events)
        {
            this.destination = destination;
            this.sequenceToken = sequenceToken;
            this.events = events;
        }
    }

    private Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private AtomicInteger tokenCounter = new AtomicInteger();

    public volatile boolean overlapDetected;
    public List<Submission> submissions = Collections.synchronizedList(new ArrayList<Submission>());
    public AtomicInteger invocationCount = new AtomicInteger();


    @Override
    public String submit(List<LogEvent> events, String logGroupName, String logStreamName, String sequenceToken)
    {
        invocationCount.incrementAndGet();
        String destination = logGroupName + "/" + logStreamName;
        if (! inFlight.add(destination))
        {
            overlapDetected = true;
            throw new IllegalStateException("overlapping submission for " + destination);
        }

        try
        {
            String nextToken = doSubmit(events, destination, sequenceToken);
            submissions.add(new Submission(destination, sequenceToken, new ArrayList<LogEvent>(events)));
            return nextToken;
        }
        finally
        {
            inFlight.remove(destination);
        }
    }


    /**
     *  The default implementation succeeds immediately.
     */
    protected String doSubmit(List<LogEvent> events, String destination, String sequenceToken)
    {
        return "T" + tokenCounter.incrementAndGet();
    }


    /**
     *  Returns the total number of events successfully submitted.
     */
    public int eventCount()
    {
        int count = 0;
        synchronized (submissions)
        {
            for (Submission submission : submissions)
            {
                count += submission.events.size();
            }
        }
        return count;
    }
}
