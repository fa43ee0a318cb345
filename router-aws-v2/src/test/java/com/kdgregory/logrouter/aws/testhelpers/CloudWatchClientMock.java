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


package com.kdgregory.logrouter.aws.testhelpers;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.*;
import software.amazon.awssdk.services.cloudwatchlogs.paginators.*;

import com.kdgregory.logrouter.cloudwatch.CloudWatchConstants;


/**
 *  A proxy-based stand-in for <code>CloudWatchLogsClient</code>, which keeps an
 *  in-memory model of log groups, the streams in each group, and each stream's
 *  upload sequence token. The default behavior follows the service: creating a
 *  resource that exists, or writing to one that doesn't, throws the SDK's
 *  exception, and <code>PutLogEvents</code> rejects any token other than the
 *  stream's current one.
 *  <p>
 *  Tests override the protected per-operation methods to inject failures. Every
 *  call is counted, and the last request for each operation is kept in a public
 *  field.
 *  <p>
 *  Describe calls return at most <code>pageSize</code> entries, so that tests
 *  can exercise the SDK's paginators. As a simplification, paging is applied
 *  before the name-prefix filter.
 */
public class CloudWatchClientMock
implements InvocationHandler
{
    private final static String ARN_PREFIX = "arn:aws:logs:us-east-1:123456789012:log-group:";

    // group name -> stream names, both in creation order
    public Map<String,List<String>> logGroups = new LinkedHashMap<String,List<String>>();

    // "group/stream" -> current token; absent until the stream is first written
    public Map<String,Integer> sequenceTokens = new HashMap<String,Integer>();

    private int pageSize = Integer.MAX_VALUE;
    private Map<String,Integer> invocationCounts = new HashMap<String,Integer>();
    private CloudWatchLogsClient client;

    public DescribeLogGroupsRequest lastDescribeLogGroupsRequest;
    public DescribeLogStreamsRequest lastDescribeLogStreamsRequest;
    public CreateLogGroupRequest lastCreateLogGroupRequest;
    public CreateLogStreamRequest lastCreateLogStreamRequest;
    public PutRetentionPolicyRequest lastPutRetentionPolicyRequest;
    public PutLogEventsRequest lastPutLogEventsRequest;


    /**
     *  Constructs an instance with no log groups.
     */
    public CloudWatchClientMock()
    {
        // nothing here
    }


    /**
     *  Constructs an instance in which each of the named groups contains each
     *  of the named streams.
     */
    public CloudWatchClientMock(List<String> groupNames, List<String> streamNames)
    {
        for (String groupName : groupNames)
        {
            logGroups.put(groupName, new ArrayList<String>(streamNames));
        }
    }

//----------------------------------------------------------------------------
//  Public API
//----------------------------------------------------------------------------

    public CloudWatchLogsClient createClient()
    {
        if (client == null)
        {
            client = (CloudWatchLogsClient)Proxy.newProxyInstance(
                            getClass().getClassLoader(),
                            new Class<?>[] { CloudWatchLogsClient.class },
                            this);
        }
        return client;
    }


    /**
     *  Limits the number of entries returned by a single describe call.
     */
    public CloudWatchClientMock withPageSize(int value)
    {
        pageSize = value;
        return this;
    }


    /**
     *  Sets the stream's current token, as if it had been written.
     */
    public CloudWatchClientMock withSequenceToken(String groupName, String streamName, int value)
    {
        sequenceTokens.put(groupName + "/" + streamName, Integer.valueOf(value));
        return this;
    }


    /**
     *  Returns the stream's current token, null if it has never been written.
     */
    public String getSequenceToken(String groupName, String streamName)
    {
        Integer value = sequenceTokens.get(groupName + "/" + streamName);
        return (value == null) ? null : value.toString();
    }


    /**
     *  Returns the number of times that the named client method was called.
     */
    public int invocationCount(String methodName)
    {
        Integer count = invocationCounts.get(methodName);
        return (count == null) ? 0 : count.intValue();
    }

//----------------------------------------------------------------------------
//  InvocationHandler
//----------------------------------------------------------------------------

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable
    {
        String methodName = method.getName();
        invocationCounts.put(methodName, Integer.valueOf(invocationCount(methodName) + 1));

        switch (methodName)
        {
            // paginators are default methods on the client interface; the iterables
            // that they return call back into the proxy for each page
            case "describeLogGroupsPaginator":
                return new DescribeLogGroupsIterable(client, (DescribeLogGroupsRequest)args[0]);
            case "describeLogStreamsPaginator":
                return new DescribeLogStreamsIterable(client, (DescribeLogStreamsRequest)args[0]);
            case "describeLogGroups":
                lastDescribeLogGroupsRequest = (DescribeLogGroupsRequest)args[0];
                return describeLogGroups(lastDescribeLogGroupsRequest);
            case "describeLogStreams":
                lastDescribeLogStreamsRequest = (DescribeLogStreamsRequest)args[0];
                return describeLogStreams(lastDescribeLogStreamsRequest);
            case "createLogGroup":
                lastCreateLogGroupRequest = (CreateLogGroupRequest)args[0];
                return createLogGroup(lastCreateLogGroupRequest);
            case "createLogStream":
                lastCreateLogStreamRequest = (CreateLogStreamRequest)args[0];
                return createLogStream(lastCreateLogStreamRequest);
            case "putRetentionPolicy":
                lastPutRetentionPolicyRequest = (PutRetentionPolicyRequest)args[0];
                return putRetentionPolicy(lastPutRetentionPolicyRequest);
            case "putLogEvents":
                lastPutLogEventsRequest = (PutLogEventsRequest)args[0];
                return putLogEvents(lastPutLogEventsRequest);
            case "close":
                return null;
            default:
                throw new UnsupportedOperationException("unexpected client call: " + methodName);
        }
    }

//----------------------------------------------------------------------------
//  Operations; override to change behavior
//----------------------------------------------------------------------------

    protected DescribeLogGroupsResponse describeLogGroups(DescribeLogGroupsRequest request)
    {
        List<String> names = new ArrayList<String>(logGroups.keySet());
        int start = pageStart(request.nextToken());
        int end = pageEnd(start, names.size());

        List<LogGroup> result = new ArrayList<LogGroup>();
        for (String name : names.subList(start, end))
        {
            if (matches(name, request.logGroupNamePrefix()))
                result.add(LogGroup.builder().logGroupName(name).arn(ARN_PREFIX + name).build());
        }

        return DescribeLogGroupsResponse.builder()
               .logGroups(result)
               .nextToken(nextPageToken(end, names.size()))
               .build();
    }


    protected DescribeLogStreamsResponse describeLogStreams(DescribeLogStreamsRequest request)
    {
        String groupName = request.logGroupName();
        List<String> names = requireGroup(groupName);
        int start = pageStart(request.nextToken());
        int end = pageEnd(start, names.size());

        List<LogStream> result = new ArrayList<LogStream>();
        for (String name : names.subList(start, end))
        {
            if (matches(name, request.logStreamNamePrefix()))
            {
                result.add(LogStream.builder()
                           .logStreamName(name)
                           .arn(ARN_PREFIX + groupName + ":log-stream:" + name)
                           .uploadSequenceToken(getSequenceToken(groupName, name))
                           .build());
            }
        }

        return DescribeLogStreamsResponse.builder()
               .logStreams(result)
               .nextToken(nextPageToken(end, names.size()))
               .build();
    }


    protected CreateLogGroupResponse createLogGroup(CreateLogGroupRequest request)
    {
        if (logGroups.containsKey(request.logGroupName()))
            throw ResourceAlreadyExistsException.builder().message("The specified log group already exists").build();

        logGroups.put(request.logGroupName(), new ArrayList<String>());
        return CreateLogGroupResponse.builder().build();
    }


    protected CreateLogStreamResponse createLogStream(CreateLogStreamRequest request)
    {
        List<String> streams = requireGroup(request.logGroupName());
        if (streams.contains(request.logStreamName()))
            throw ResourceAlreadyExistsException.builder().message("The specified log stream already exists").build();

        streams.add(request.logStreamName());
        return CreateLogStreamResponse.builder().build();
    }


    protected PutRetentionPolicyResponse putRetentionPolicy(PutRetentionPolicyRequest request)
    {
        requireGroup(request.logGroupName());
        try
        {
            CloudWatchConstants.validateRetentionPeriod(request.retentionInDays());
        }
        catch (IllegalArgumentException ex)
        {
            throw InvalidParameterException.builder().message(ex.getMessage()).build();
        }
        return PutRetentionPolicyResponse.builder().build();
    }


    protected PutLogEventsResponse putLogEvents(PutLogEventsRequest request)
    {
        List<String> streams = requireGroup(request.logGroupName());
        if (! streams.contains(request.logStreamName()))
            throw ResourceNotFoundException.builder().message("The specified log stream does not exist.").build();

        String expected = getSequenceToken(request.logGroupName(), request.logStreamName());
        String actual = request.sequenceToken();
        boolean tokenMatches = (expected == null) ? (actual == null) : expected.equals(actual);
        if (! tokenMatches)
        {
            throw InvalidSequenceTokenException.builder()
                  .message("The given sequenceToken is invalid. The next expected sequenceToken is: " + expected)
                  .expectedSequenceToken(expected)
                  .build();
        }

        int next = (expected == null) ? 1 : Integer.parseInt(expected) + 1;
        withSequenceToken(request.logGroupName(), request.logStreamName(), next);
        return PutLogEventsResponse.builder().nextSequenceToken(String.valueOf(next)).build();
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private List<String> requireGroup(String groupName)
    {
        List<String> streams = logGroups.get(groupName);
        if (streams == null)
            throw ResourceNotFoundException.builder().message("The specified log group does not exist.").build();
        return streams;
    }


    private static boolean matches(String name, String prefix)
    {
        return (prefix == null) || name.startsWith(prefix);
    }


    private static int pageStart(String nextToken)
    {
        return (nextToken == null) ? 0 : Integer.parseInt(nextToken);
    }


    private int pageEnd(int start, int size)
    {
        return (int)Math.min((long)start + pageSize, size);
    }


    private static String nextPageToken(int end, int size)
    {
        return (end < size) ? String.valueOf(end) : null;
    }
}
