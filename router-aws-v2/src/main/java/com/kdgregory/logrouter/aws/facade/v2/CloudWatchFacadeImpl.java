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

package com.kdgregory.logrouter.aws.facade.v2;

import java.util.List;
import java.util.stream.Collectors;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.*;
import software.amazon.awssdk.services.cloudwatchlogs.paginators.*;

import com.kdgregory.logrouter.aws.facade.v2.internal.ClientFactory;
import com.kdgregory.logrouter.cloudwatch.CloudWatchConstants;
import com.kdgregory.logrouter.cloudwatch.CloudWatchRouterConfig;
import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.facade.CloudWatchFacade;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException.ReasonCode;


/**
 *  Provides a facade over the CloudWatch Logs API using the v2 SDK. A single
 *  instance (and client) serves all destinations.
 *  <p>
 *  Sequence tokens: the router represents "no token" as an empty string, the
 *  SDK as null. Conversion happens here.
 */
public class CloudWatchFacadeImpl
implements CloudWatchFacade
{
    // passed to constructor
    private CloudWatchRouterConfig config;

    // lazily constructed; protected so that it can be set for testing
    protected CloudWatchLogsClient client;


    public CloudWatchFacadeImpl(CloudWatchRouterConfig config)
    {
        this.config = config;
    }

//----------------------------------------------------------------------------
//  CloudWatchFacade
//----------------------------------------------------------------------------

    @Override
    public String findLogGroup(String logGroupName)
    {
        try
        {
            DescribeLogGroupsRequest request = DescribeLogGroupsRequest.builder()
                                               .logGroupNamePrefix(logGroupName)
                                               .build();
            DescribeLogGroupsIterable itx = client().describeLogGroupsPaginator(request);
            for (LogGroup logGroup : itx.logGroups())
            {
                if (logGroup.logGroupName().equals(logGroupName))
                    return logGroup.arn();
            }

            return null;
        }
        catch (Exception ex)
        {
            CloudWatchFacadeException ex2 = transformException("findLogGroup", ex, logGroupName, null);
            if (ex2.isRetryable())
                return null;
            else
                throw ex2;
        }
    }


    @Override
    public void createLogGroup(String logGroupName)
    {
        try
        {
            CreateLogGroupRequest request = CreateLogGroupRequest.builder()
                                            .logGroupName(logGroupName)
                                            .build();
            client().createLogGroup(request);
            return;
        }
        catch (ResourceAlreadyExistsException ex)
        {
            // somebody else created it, nothing to do here
            return;
        }
        catch (Exception ex)
        {
            throw transformException("createLogGroup", ex, logGroupName, null);
        }
    }


    @Override
    public void setLogGroupRetention(String logGroupName, int retentionDays)
    {
        try
        {
            PutRetentionPolicyRequest request = PutRetentionPolicyRequest.builder()
                                                .logGroupName(logGroupName)
                                                .retentionInDays(retentionDays)
                                                .build();
            client().putRetentionPolicy(request);
        }
        catch (InvalidParameterException ex)
        {
            throw new CloudWatchFacadeException(
                "invalid retention period: " + retentionDays,
                ReasonCode.INVALID_CONFIGURATION,
                false,
                "setLogGroupRetention", logGroupName);
        }
        catch (Exception ex)
        {
            throw transformException("setLogGroupRetention", ex, logGroupName, null);
        }
    }


    @Override
    public String findLogStream(String logGroupName, String logStreamName)
    {
        try
        {
            LogStream stream = describeLogStream(logGroupName, logStreamName);
            return (stream != null) ? stream.arn() : null;
        }
        catch (ResourceNotFoundException ex)
        {
            return null;
        }
        catch (Exception ex)
        {
            CloudWatchFacadeException ex2 = transformException("findLogStream", ex, logGroupName, logStreamName);
            if (ex2.isRetryable())
                return null;
            else
                throw ex2;
        }
    }


    @Override
    public void createLogStream(String logGroupName, String logStreamName)
    {
        try
        {
            CreateLogStreamRequest request = CreateLogStreamRequest.builder()
                                            .logGroupName(logGroupName)
                                            .logStreamName(logStreamName)
                                            .build();
            client().createLogStream(request);
            return;
        }
        catch (ResourceAlreadyExistsException ex)
        {
            // somebody else created it, nothing to do here
            return;
        }
        catch (ResourceNotFoundException ex)
        {
            throw new CloudWatchFacadeException(
                "log group missing",
                ReasonCode.MISSING_LOG_GROUP,
                false,
                "createLogStream",
                logGroupName);
        }
        catch (Exception ex)
        {
            throw transformException("createLogStream", ex, logGroupName, logStreamName);
        }
    }


    @Override
    public String retrieveSequenceToken(String logGroupName, String logStreamName)
    {
        LogStream stream;
        try
        {
            stream = describeLogStream(logGroupName, logStreamName);
        }
        catch (ResourceNotFoundException ex)
        {
            throw new CloudWatchFacadeException(
                "log group missing",
                ReasonCode.MISSING_LOG_GROUP,
                false,
                "retrieveSequenceToken",
                logGroupName);
        }
        catch (Exception ex)
        {
            throw transformException("retrieveSequenceToken", ex, logGroupName, logStreamName);
        }

        if (stream == null)
        {
            throw new CloudWatchFacadeException(
                "log stream missing",
                ReasonCode.MISSING_LOG_STREAM,
                false,
                "retrieveSequenceToken",
                logGroupName, logStreamName);
        }

        return stream.uploadSequenceToken();
    }


    @Override
    public String putEvents(String logGroupName, String logStreamName, String sequenceToken, List<LogEvent> events)
    {
        if (events.isEmpty())
            return sequenceToken;

        List<InputLogEvent> logEvents
                = events.stream()
                  .map(e -> InputLogEvent.builder().timestamp(e.getTimestamp()).message(e.getMessage()).build())
                  .collect(Collectors.toList());

        PutLogEventsRequest request
                = PutLogEventsRequest.builder()
                  .logGroupName(logGroupName)
                  .logStreamName(logStreamName)
                  .sequenceToken(CloudWatchConstants.EMPTY_TOKEN.equals(sequenceToken) ? null : sequenceToken)
                  .logEvents(logEvents)
                  .build();

        try
        {
            // the router ensures that all events meet acceptance criteria, so we don't
            // check for rejected events (there's nothing we could do about it anyway)
            PutLogEventsResponse response = client().putLogEvents(request);
            String nextToken = response.nextSequenceToken();
            return (nextToken != null) ? nextToken : CloudWatchConstants.EMPTY_TOKEN;
        }
        catch (InvalidSequenceTokenException ex)
        {
            throw new CloudWatchFacadeException(
                    "invalid sequence token: " + sequenceToken,
                    ex,
                    ReasonCode.INVALID_SEQUENCE_TOKEN,
                    false,
                    "putEvents", logGroupName, logStreamName);
        }
        catch (DataAlreadyAcceptedException ex)
        {
            throw new CloudWatchFacadeException(
                    "already processed",
                    ex,
                    ReasonCode.ALREADY_PROCESSED,
                    false,
                    "putEvents", logGroupName, logStreamName);
        }
        catch (ResourceNotFoundException ex)
        {
            boolean streamMissing = String.valueOf(ex.getMessage()).contains("log stream");
            throw new CloudWatchFacadeException(
                    streamMissing ? "missing log stream" : "missing log group",
                    ex,
                    streamMissing ? ReasonCode.MISSING_LOG_STREAM : ReasonCode.MISSING_LOG_GROUP,
                    false,
                    "putEvents", logGroupName, logStreamName);
        }
        catch (Exception ex)
        {
            throw transformException("putEvents", ex, logGroupName, logStreamName);
        }
    }


    @Override
    public void shutdown()
    {
        client().close();
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Returns the CloudWatch Logs client, lazily constructing it if needed.
     *  Synchronized because the facade is shared by the host's threads and the
     *  sweeper.
     */
    protected synchronized CloudWatchLogsClient client()
    {
        if (client == null)
        {
            client = new ClientFactory(config).create();
        }

        return client;
    }


    /**
     *  Finds the named stream, returning null if it doesn't exist. Throws if the
     *  group doesn't exist or for any other SDK error.
     */
    private LogStream describeLogStream(String logGroupName, String logStreamName)
    {
        DescribeLogStreamsRequest request = DescribeLogStreamsRequest.builder()
                                            .logGroupName(logGroupName)
                                            .logStreamNamePrefix(logStreamName)
                                            .build();

        DescribeLogStreamsIterable itx = client().describeLogStreamsPaginator(request);
        for (LogStream stream : itx.logStreams())
        {
            if (stream.logStreamName().equals(logStreamName))
                return stream;
        }
        return null;
    }


    /**
     *  Translates a source exception into an instance of CloudWatchFacadeException.
     */
    private CloudWatchFacadeException transformException(String functionName, Exception cause, String logGroupName, String logStreamName)
    {
        ReasonCode reason;
        String message;
        boolean isRetryable;

        if (cause == null)
        {
            reason = ReasonCode.UNEXPECTED_EXCEPTION;
            message = "coding error; exception not provided";
            isRetryable = false;
        }
        else if (cause instanceof CloudWatchFacadeException)
        {
            return (CloudWatchFacadeException)cause;
        }
        else if (cause instanceof OperationAbortedException)
        {
            reason = ReasonCode.ABORTED;
            message = "request aborted";
            isRetryable = true;
        }
        else if (cause instanceof CloudWatchLogsException)
        {
            CloudWatchLogsException ex = (CloudWatchLogsException)cause;
            String errorCode = (ex.awsErrorDetails() != null) ? ex.awsErrorDetails().errorCode() : null;
            if ("ThrottlingException".equals(errorCode))
            {
                reason = ReasonCode.THROTTLING;
                message = "request throttled";
                isRetryable = true;
            }
            else
            {
                reason = ReasonCode.UNEXPECTED_EXCEPTION;
                message = "service exception: " + cause.getMessage();
                isRetryable = false;  // SDKException considers some things retryable that we don't
            }
        }
        else
        {
            reason = ReasonCode.UNEXPECTED_EXCEPTION;
            message = "unexpected exception: " + cause.getMessage();
            isRetryable = false;
        }

        return new CloudWatchFacadeException(
                message, cause, reason, isRetryable,
                functionName, logGroupName, logStreamName);
    }
}
