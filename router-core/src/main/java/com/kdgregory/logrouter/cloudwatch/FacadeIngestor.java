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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.common.util.RetryManager;
import com.kdgregory.logrouter.facade.CloudWatchFacade;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException.ReasonCode;


/**
 *  Submits batches using a {@link CloudWatchFacade}. Throttled requests are retried
 *  until the configured send timeout expires; all other failures are passed to the
 *  caller on the first attempt.
 *  <p>
 *  Implementation note: the retry manager is exposed so that tests can replace it.
 */
public class FacadeIngestor
implements Ingestor
{
    private CloudWatchRouterConfig config;
    private CloudWatchFacade facade;
    private CloudWatchRouterStatistics stats;

    protected RetryManager sendRetry = new RetryManager("send", Duration.ofMillis(200), Duration.ofMillis(1000), true, false);


    public FacadeIngestor(CloudWatchRouterConfig config, CloudWatchFacade facade, CloudWatchRouterStatistics stats)
    {
        this.config = config;
        this.facade = facade;
        this.stats = stats;
    }


    @Override
    public String submit(List<LogEvent> events, String logGroupName, String logStreamName, String sequenceToken)
    {
        Instant timeoutAt = Instant.now().plusMillis(config.getSendTimeout());
        String nextToken = sendRetry.invoke(timeoutAt, () ->
        {
            try
            {
                return facade.putEvents(logGroupName, logStreamName, sequenceToken, events);
            }
            catch (CloudWatchFacadeException ex)
            {
                if (ex.getReason() != ReasonCode.THROTTLING)
                    throw ex;

                stats.incrementThrottledWrites();
                return null;
            }
        });

        if (nextToken == null)
        {
            throw new CloudWatchFacadeException(
                "repeated throttling", ReasonCode.THROTTLING, true,
                "submit", logGroupName, logStreamName);
        }

        return nextToken;
    }
}
