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


/**
 *  Holds limits and other constants for CloudWatch Logs.
 *  <p>
 *  The batch limits are deliberately tighter than the current service limits:
 *  they bound memory per source and keep each request (made while holding the
 *  registry lock) small.
 *  <p>
 *  See http://docs.aws.amazon.com/AmazonCloudWatchLogs/latest/APIReference/API_PutLogEvents.html
 */
public class CloudWatchConstants
{
    /**
     *  Maximum number of events in a single batch.
     */
    public final static int MAX_BATCH_COUNT = 1000;


    /**
     *  Maximum number of bytes in a single batch. This includes the event bytes
     *  as well as per-event overhead.
     */
    public final static int MAX_BATCH_BYTES = 32768;


    /**
     *  Overhead that the service adds to each event when computing batch size.
     */
    public final static int MESSAGE_OVERHEAD = 28;


    /**
     *  The maximum number of bytes in a single event, after conversion to UTF-8.
     *  An event of this size fills a batch on its own.
     */
    public final static int MAX_MESSAGE_SIZE = MAX_BATCH_BYTES - MESSAGE_OVERHEAD;


    /**
     *  The default interval between sweeps, in milliseconds. No event waits
     *  longer than this (plus the time to flush) before being submitted.
     */
    public final static long DEFAULT_SWEEP_INTERVAL = 10000;


    /**
     *  The sequence token used for the first write to a new stream.
     */
    public final static String EMPTY_TOKEN = "";


    /**
     *  Used to validate log group names.
     */
    public final static String ALLOWED_GROUP_NAME_REGEX = "[A-Za-z0-9_/.#-]{1,512}";


    /**
     *  Used to validate log stream names.
     */
    public final static String ALLOWED_STREAM_NAME_REGEX = "[^:*]{1,512}";


    /**
     *  Returns the number of bytes that an event with the given payload size
     *  contributes to a batch.
     */
    public static int effectiveSize(int payloadSize)
    {
        return payloadSize + MESSAGE_OVERHEAD;
    }


    /**
     *  Validates proposed retention period, throwing if invalid.
     */
    public static Integer validateRetentionPeriod(Integer value)
    {
        // null means no retention period
        if (value == null)
            return value;

        // values per https://docs.aws.amazon.com/AmazonCloudWatchLogs/latest/APIReference/API_PutRetentionPolicy.html
        switch (value.intValue())
        {
            case 1 :
            case 3 :
            case 5 :
            case 7 :
            case 14 :
            case 30 :
            case 60 :
            case 90 :
            case 120 :
            case 150 :
            case 180 :
            case 365 :
            case 400 :
            case 545 :
            case 731 :
            case 1096 :
            case 1827 :
            case 2192 :
            case 2557 :
            case 2922 :
            case 3288 :
            case 3653 :
                return value;
            default :
                throw new IllegalArgumentException("invalid retention period: " + value + "; see AWS API for allowed values");
        }
    }
}
