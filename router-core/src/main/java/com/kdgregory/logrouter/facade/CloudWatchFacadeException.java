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


/**
 *  Thrown by {@link CloudWatchFacade} operations. Translates SDK-specific
 *  exceptions into a reason code that the router can act on, and identifies
 *  the function and destination in its message.
 */
public class CloudWatchFacadeException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;


    /**
     *  The reasons that an operation can fail.
     */
    public enum ReasonCode
    {
        /** Request was throttled; retry after a delay. */
        THROTTLING,

        /** The sequence token passed to PutLogEvents was not the stream's current token. */
        INVALID_SEQUENCE_TOKEN,

        /** The batch was already accepted by a previous request. */
        ALREADY_PROCESSED,

        /** The log group does not exist. */
        MISSING_LOG_GROUP,

        /** The log stream does not exist. */
        MISSING_LOG_STREAM,

        /** The request was rejected because of a configuration value (eg, retention period). */
        INVALID_CONFIGURATION,

        /** A concurrent operation on the same resource caused this one to abort. */
        ABORTED,

        /** Anything else. */
        UNEXPECTED_EXCEPTION
    }


    private ReasonCode reason;
    private boolean isRetryable;
    private String functionName;


    /**
     *  Constructs an instance without an underlying cause.
     *
     *  @param  message         Describes the failure.
     *  @param  reason          The reason code.
     *  @param  isRetryable     Whether the caller may retry the same request.
     *  @param  functionName    The facade function that failed.
     *  @param  resourceNames   Log group and (optionally) stream, included in the message.
     */
    public CloudWatchFacadeException(
        String message, ReasonCode reason, boolean isRetryable,
        String functionName, String... resourceNames)
    {
        this(message, null, reason, isRetryable, functionName, resourceNames);
    }


    /**
     *  Constructs an instance that wraps an SDK exception.
     */
    public CloudWatchFacadeException(
        String message, Throwable cause, ReasonCode reason, boolean isRetryable,
        String functionName, String... resourceNames)
    {
        super(constructMessage(functionName, message, resourceNames), cause);
        this.reason = reason;
        this.isRetryable = isRetryable;
        this.functionName = functionName;
    }


    public ReasonCode getReason()
    {
        return reason;
    }


    public boolean isRetryable()
    {
        return isRetryable;
    }


    public String getFunctionName()
    {
        return functionName;
    }


    private static String constructMessage(String functionName, String message, String... resourceNames)
    {
        StringBuilder sb = new StringBuilder(128).append(functionName).append("(");
        for (int ii = 0 ; ii < resourceNames.length ; ii++)
        {
            if (resourceNames[ii] == null)
                continue;
            if (ii > 0)
                sb.append(",");
            sb.append(resourceNames[ii]);
        }
        return sb.append("): ").append(message).toString();
    }
}
