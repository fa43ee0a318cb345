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

import java.util.Date;
import java.util.List;


/**
 *  Defines the JMX Bean interface for {@link CloudWatchRouterStatistics}.
 */
public interface CloudWatchRouterStatisticsMXBean
{
    /**
     *  Returns the number of sources that currently have a batch.
     */
    int getActiveSources();


    /**
     *  Returns the number of events that have been added to a batch.
     */
    long getEventsAccepted();


    /**
     *  Returns the number of events that were dropped: because they didn't fit
     *  in a batch that couldn't be flushed, because they were pending when a
     *  source stopped and its final flush failed, or because they were oversize
     *  and truncation is disabled.
     */
    long getEventsDropped();


    /**
     *  Returns the number of events received for a source that wasn't registered.
     */
    long getUnroutableEvents();


    /**
     *  Returns the number of events that exceeded the maximum event size.
     */
    long getOversizeMessages();


    /**
     *  Returns the number of batches successfully submitted.
     */
    long getBatchesSent();


    /**
     *  Returns the number of events successfully submitted.
     */
    long getEventsSent();


    /**
     *  Returns the number of submissions that failed.
     */
    long getFailedFlushes();


    /**
     *  Returns the number of times a sequence token was re-read from the service
     *  after a rejected submission.
     */
    long getTokenRefreshes();


    /**
     *  Returns the number of sources admitted without a confirmed destination.
     */
    long getProvisioningFailures();


    /**
     *  Returns the number of submission attempts that were throttled.
     */
    long getThrottledWrites();


    /**
     *  Returns the most recent error message.
     */
    String getLastErrorMessage();


    /**
     *  Returns the time of the most recent error.
     */
    Date getLastErrorTimestamp();


    /**
     *  Returns the stack trace of the most recent error, if it had an exception.
     */
    List<String> getLastErrorStacktrace();
}
