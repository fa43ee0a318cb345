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
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import com.kdgregory.logrouter.common.util.InternalLogger;
import com.kdgregory.logrouter.common.util.RetryManager;
import com.kdgregory.logrouter.facade.CloudWatchFacade;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException.ReasonCode;


/**
 *  Provisions destinations using a {@link CloudWatchFacade}: creates the group and
 *  stream if they don't exist, waits for them to become visible, and retrieves the
 *  stream's sequence token.
 *  <p>
 *  All work for one call must complete within the configured initialization timeout.
 *  <p>
 *  Implementation note: the retry managers are exposed so that tests can replace
 *  them with shorter delays.
 */
public class FacadeStreamProvisioner
implements StreamProvisioner
{
    private CloudWatchRouterConfig config;
    private CloudWatchFacade facade;
    private InternalLogger logger;

    // controls the retries for findLogGroup, findLogStream, and retrieveSequenceToken
    protected RetryManager describeRetry = new RetryManager("describe", Duration.ofMillis(50));

    // controls the retries for creating groups and streams
    protected RetryManager createRetry = new RetryManager("create", Duration.ofMillis(200));


    public FacadeStreamProvisioner(CloudWatchRouterConfig config, CloudWatchFacade facade, InternalLogger logger)
    {
        this.config = config;
        this.facade = facade;
        this.logger = logger;
    }


    @Override
    public synchronized String openStream(String logGroupName, String logStreamName)
    {
        validateNames(logGroupName, logStreamName);

        Instant timeoutAt = Instant.now().plusMillis(config.getInitializationTimeout());

        logger.debug("checking for existence of CloudWatch log group: " + logGroupName);
        if (facade.findLogGroup(logGroupName) == null)
            createLogGroup(logGroupName, timeoutAt);

        logger.debug("checking for existence of CloudWatch log stream: " + logGroupName + "/" + logStreamName);
        if (facade.findLogStream(logGroupName, logStreamName) == null)
            createLogStream(logGroupName, logStreamName, timeoutAt);

        // a throttled find also returns null, so the stream may have existed all
        // along; the token must come from the service either way
        Optional<String> token = describeRetry.invoke(
                                    timeoutAt,
                                    () -> Optional.ofNullable(facade.retrieveSequenceToken(logGroupName, logStreamName)),
                                    new RetryableExceptionHandler());
        return token.orElse(CloudWatchConstants.EMPTY_TOKEN);
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private void validateNames(String logGroupName, String logStreamName)
    {
        if ((logGroupName == null) || ! Pattern.matches(CloudWatchConstants.ALLOWED_GROUP_NAME_REGEX, logGroupName))
        {
            throw new CloudWatchFacadeException(
                "invalid log group name", ReasonCode.INVALID_CONFIGURATION, false,
                "openStream", logGroupName, logStreamName);
        }

        if ((logStreamName == null) || ! Pattern.matches(CloudWatchConstants.ALLOWED_STREAM_NAME_REGEX, logStreamName))
        {
            throw new CloudWatchFacadeException(
                "invalid log stream name", ReasonCode.INVALID_CONFIGURATION, false,
                "openStream", logGroupName, logStreamName);
        }
    }


    private void createLogGroup(String logGroupName, Instant timeoutAt)
    {
        logger.debug("creating CloudWatch log group: " + logGroupName);

        createRetry.invoke(timeoutAt,
                           () -> { facade.createLogGroup(logGroupName); return Boolean.TRUE; },
                           new RetryableExceptionHandler());

        // creation is asynchronous; this throws if the group never appears
        describeRetry.invoke(timeoutAt, () -> facade.findLogGroup(logGroupName));

        Integer retentionPeriod = config.getRetentionPeriod();
        if (retentionPeriod == null)
            return;

        try
        {
            logger.debug("setting retention period for " + logGroupName + " to " + retentionPeriod + " days");
            facade.setLogGroupRetention(logGroupName, retentionPeriod.intValue());
        }
        catch (CloudWatchFacadeException ex)
        {
            // the group is usable without retention, so this doesn't fail provisioning
            logger.error("exception setting retention policy for " + logGroupName, ex);
        }
    }


    private void createLogStream(String logGroupName, String logStreamName, Instant timeoutAt)
    {
        logger.debug("creating CloudWatch log stream: " + logGroupName + "/" + logStreamName);

        createRetry.invoke(timeoutAt,
                           () -> { facade.createLogStream(logGroupName, logStreamName); return Boolean.TRUE; },
                           new RetryableExceptionHandler());

        describeRetry.invoke(timeoutAt, () -> facade.findLogStream(logGroupName, logStreamName));
    }


    /**
     *  Swallows retryable facade exceptions (so that the operation is retried),
     *  rethrows everything else.
     */
    private static class RetryableExceptionHandler
    implements Consumer<RuntimeException>
    {
        @Override
        public void accept(RuntimeException ex)
        {
            if ((ex instanceof CloudWatchFacadeException) && ((CloudWatchFacadeException)ex).isRetryable())
                return;
            else
                throw ex;
        }
    }
}
