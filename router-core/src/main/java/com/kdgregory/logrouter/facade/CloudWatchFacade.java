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

package com.kdgregory.logrouter.facade;

import java.util.List;

import com.kdgregory.logrouter.common.LogEvent;


/**
 *  Exposes the CloudWatch Logs APIs used by the router. Unlike a per-writer
 *  client, a single instance serves every destination, so each operation is
 *  told which log group and stream it applies to.
 *  <p>
 *  Implementations live in SDK-specific modules; the router core only sees this
 *  interface. Implementations must be safe for concurrent use by multiple
 *  threads (the underlying SDK clients are).
 *  <p>
 *  All operations may throw {@link CloudWatchFacadeException}. Callers decide
 *  what to do based on its reason code.
 */
public interface CloudWatchFacade
{
    /**
     *  Determines whether the log group exists, returning its ARN if it does.
     *  Returns <code>null</code> if the group doesn't exist or the call was
     *  throttled.
     */
    String findLogGroup(String logGroupName);


    /**
     *  Attempts to create the log group. Succeeds silently if the group already
     *  exists.
     *  <p>
     *  Creation is asynchronous: call {@link #findLogGroup} (with delays) until
     *  it returns a value.
     */
    void createLogGroup(String logGroupName);


    /**
     *  Sets the retention period on the log group. The value must be one that
     *  CloudWatch accepts.
     */
    void setLogGroupRetention(String logGroupName, int retentionDays);


    /**
     *  Determines whether the log stream exists, returning its ARN if it does.
     *  Returns <code>null</code> if either group or stream doesn't exist, or the
     *  call was throttled.
     */
    String findLogStream(String logGroupName, String logStreamName);


    /**
     *  Attempts to create the log stream. Succeeds silently if the stream already
     *  exists.
     */
    void createLogStream(String logGroupName, String logStreamName);


    /**
     *  Returns the stream's current upload sequence token, <code>null</code> if the
     *  stream has never been written. Since <code>null</code> is a valid result, a
     *  throttled call throws (with a retryable exception) rather than returning it.
     *
     *  @throws CloudWatchFacadeException with reason <code>MISSING_LOG_GROUP</code>
     *          or <code>MISSING_LOG_STREAM</code> if the destination doesn't exist.
     */
    String retrieveSequenceToken(String logGroupName, String logStreamName);


    /**
     *  Writes a batch of events to the stream, returning the sequence token for the
     *  next write.
     *
     *  @param  sequenceToken   The token returned by the previous write, or the
     *                          empty string for the first write to a new stream.
     *  @param  events          The events, in the order that they should be written.
     *                          Must be within CloudWatch's batch limits.
     *
     *  @throws CloudWatchFacadeException with reason <code>INVALID_SEQUENCE_TOKEN</code>
     *          if the token doesn't match the stream's current token.
     */
    String putEvents(String logGroupName, String logStreamName, String sequenceToken, List<LogEvent> events);


    /**
     *  Shuts down the underlying client.
     */
    void shutdown();
}
