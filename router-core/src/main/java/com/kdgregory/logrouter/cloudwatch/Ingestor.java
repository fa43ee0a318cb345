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

import com.kdgregory.logrouter.common.LogEvent;


/**
 *  Submits a batch of events to a destination.
 */
public interface Ingestor
{
    /**
     *  Writes the events, in order, and returns the token for the next write.
     *  Must return within a bounded time: callers hold the registry lock.
     *
     *  @param  events          The events; never empty.
     *  @param  logGroupName    Destination log group.
     *  @param  logStreamName   Destination log stream.
     *  @param  sequenceToken   The token returned by the previous write, or the
     *                          empty string for the first write to a new stream.
     *
     *  @throws com.kdgregory.logrouter.facade.CloudWatchFacadeException on failure;
     *          a token mismatch has reason <code>INVALID_SEQUENCE_TOKEN</code>.
     */
    String submit(List<LogEvent> events, String logGroupName, String logStreamName, String sequenceToken);
}
