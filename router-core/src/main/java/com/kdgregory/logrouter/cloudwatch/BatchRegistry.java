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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.common.util.InternalLogger;
import com.kdgregory.logrouter.facade.CloudWatchFacadeException;


/**
 *  Owns the current {@link Batch} for every active source, and is the only code
 *  that creates, replaces, or removes them.
 *  <p>
 *  Locking is two-level. The registry's monitor is held for every structural
 *  change and for the whole of "decide whether the event fits, otherwise flush
 *  and replace", which means that at most one submission per source (and so per
 *  sequence token) is ever in flight. Each batch also guards its own contents,
 *  so the read-only accessors here can inspect a batch without taking the
 *  registry lock.
 *  <p>
 *  Remote calls are made while holding the registry lock: a slow call for one
 *  source delays all others. The provisioner and ingestor bound every call with
 *  a timeout.
 *  <p>
 *  Failure policy: a batch whose submission fails transiently (or because its
 *  token or destination needs to be refreshed) is kept and retried at the next
 *  opportunity: the next sweep, the next event that doesn't fit, or the source's
 *  stop. If an event arrives that doesn't fit in such a batch, the event is
 *  dropped. A batch that the service rejects for any other non-retryable reason
 *  is discarded, as is a pending batch whose final flush fails at stop.
 */
public class BatchRegistry
{
    private StreamProvisioner provisioner;
    private Ingestor ingestor;
    private CloudWatchRouterStatistics stats;
    private InternalLogger logger;

    // structural changes happen while holding this object's monitor; lookups
    // from the accessors don't, so the map must support concurrent reads
    private Map<String,Batch> batches = new ConcurrentHashMap<String,Batch>();


    public BatchRegistry(StreamProvisioner provisioner, Ingestor ingestor, CloudWatchRouterStatistics stats, InternalLogger logger)
    {
        this.provisioner = provisioner;
        this.ingestor = ingestor;
        this.stats = stats;
        this.logger = logger;
    }

//----------------------------------------------------------------------------
//  Source lifecycle and events
//----------------------------------------------------------------------------

    /**
     *  Registers a source, provisioning its destination. If the source is already
     *  registered, this does nothing.
     *  <p>
     *  If provisioning fails, the source is still registered, using the empty token.
     *  Its first submission may be rejected; if so, the token is re-read from the
     *  service at that point.
     */
    public synchronized void start(String sourceId, String logGroupName, String logStreamName)
    {
        if (batches.containsKey(sourceId))
        {
            logger.debug("source " + sourceId + " is already registered");
            return;
        }

        String sequenceToken;
        try
        {
            sequenceToken = provisioner.openStream(logGroupName, logStreamName);
        }
        catch (RuntimeException ex)
        {
            reportError("failed to provision " + logGroupName + "/" + logStreamName
                        + " for source " + sourceId + "; accepting events without a sequence token", ex);
            stats.incrementProvisioningFailures();
            sequenceToken = CloudWatchConstants.EMPTY_TOKEN;
        }

        batches.put(sourceId, new Batch(logGroupName, logStreamName, sequenceToken));
        stats.setActiveSources(batches.size());
        logger.debug("registered source " + sourceId + " for " + logGroupName + "/" + logStreamName);
    }


    /**
     *  Flushes the source's batch and removes it from the registry. The source is
     *  removed even if the flush fails, in which case its pending events are lost.
     */
    public synchronized void stop(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        if (batch == null)
        {
            logger.debug("stop for unregistered source " + sourceId);
            return;
        }

        try
        {
            if (! flushInternal(sourceId, batch))
            {
                int pending = batch.size();
                logger.warn("final flush failed for source " + sourceId + "; dropping " + pending + " event(s)");
                stats.updateEventsDropped(pending);
            }
        }
        finally
        {
            batches.remove(sourceId);
            stats.setActiveSources(batches.size());
            logger.debug("removed source " + sourceId);
        }
    }


    /**
     *  Adds an event to the source's batch. If the batch can't accept the event,
     *  it's flushed and replaced first. Returns <code>true</code> if the event was
     *  added, <code>false</code> if it was dropped (because the source isn't
     *  registered, or the full batch couldn't be flushed).
     */
    public synchronized boolean append(String sourceId, LogEvent event)
    {
        Batch batch = batches.get(sourceId);
        if (batch == null)
        {
            logger.debug("dropped event for unregistered source " + sourceId);
            stats.incrementUnroutableEvents();
            return false;
        }

        if (! batch.accepts(event))
        {
            if (! flushInternal(sourceId, batch))
            {
                logger.warn("dropped event for source " + sourceId + ": batch is full and could not be sent");
                stats.updateEventsDropped(1);
                return false;
            }
            batch = batches.get(sourceId);
        }

        batch.append(event);
        stats.incrementEventsAccepted();
        return true;
    }


    /**
     *  Submits the source's batch if it's not empty. Returns <code>true</code> if
     *  there was nothing to send, the send succeeded, or the batch was permanently
     *  rejected and discarded; <code>false</code> if it failed and was retained
     *  for retry.
     */
    public synchronized boolean flush(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        if (batch == null)
            return true;

        return flushInternal(sourceId, batch);
    }


    /**
     *  Flushes every registered source. Returns the number of sources whose flush
     *  failed.
     */
    public synchronized int flushAll()
    {
        int failures = 0;
        for (String sourceId : new ArrayList<String>(batches.keySet()))
        {
            if (! flushInternal(sourceId, batches.get(sourceId)))
                failures++;
        }
        return failures;
    }


    /**
     *  Stops every registered source. Used at shutdown.
     */
    public synchronized void stopAll()
    {
        for (String sourceId : new ArrayList<String>(batches.keySet()))
        {
            stop(sourceId);
        }
    }

//----------------------------------------------------------------------------
//  Read-only accessors; these don't take the registry lock
//----------------------------------------------------------------------------

    public boolean isRegistered(String sourceId)
    {
        return batches.containsKey(sourceId);
    }


    /**
     *  Returns the IDs of all registered sources, at the time of the call.
     */
    public List<String> registeredSources()
    {
        return new ArrayList<String>(batches.keySet());
    }


    /**
     *  Returns the destination for a source, <code>null</code> if not registered.
     */
    public Destination destinationOf(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        return (batch == null) ? null : new Destination(batch.getLogGroupName(), batch.getLogStreamName());
    }


    /**
     *  Returns the token that the source's next submission will use, <code>null</code>
     *  if not registered.
     */
    public String sequenceToken(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        return (batch == null) ? null : batch.getSequenceToken();
    }


    /**
     *  Returns the number of events waiting to be sent for a source (0 if not registered).
     */
    public int pendingEventCount(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        return (batch == null) ? 0 : batch.size();
    }


    /**
     *  Returns the number of bytes (as counted by the service) waiting to be sent
     *  for a source (0 if not registered).
     */
    public int pendingByteCount(String sourceId)
    {
        Batch batch = batches.get(sourceId);
        return (batch == null) ? 0 : batch.byteCount();
    }

//----------------------------------------------------------------------------
//  Internals -- all of these must be called while holding the registry lock
//----------------------------------------------------------------------------

    /**
     *  Submits the batch. On success, replaces it with an empty batch carrying
     *  the returned token. On a transient failure, or one that's repaired by
     *  refreshing the token, leaves it in place (possibly with a refreshed token)
     *  and returns false. A batch rejected for any other non-retryable reason is
     *  discarded: its events are counted as dropped, it's replaced by an empty
     *  batch with the same token, and the return is true.
     */
    private boolean flushInternal(String sourceId, Batch batch)
    {
        if (batch.isEmpty())
            return true;

        List<LogEvent> events = batch.getEvents();
        String destination = batch.getDestination();
        try
        {
            String nextToken = ingestor.submit(events, batch.getLogGroupName(), batch.getLogStreamName(), batch.getSequenceToken());
            batches.put(sourceId, batch.successor(nextToken));
            stats.updateBatchSent(events.size());
            logger.debug("submitted batch of " + events.size() + " event(s) for source " + sourceId + " to " + destination);
            return true;
        }
        catch (CloudWatchFacadeException ex)
        {
            switch (ex.getReason())
            {
                case ALREADY_PROCESSED:
                    logger.warn("batch for source " + sourceId + " was already accepted by " + destination + "; discarding it");
                    batches.put(sourceId, batch.successor(refreshToken(sourceId, batch)));
                    return true;
                case INVALID_SEQUENCE_TOKEN:
                case MISSING_LOG_GROUP:
                case MISSING_LOG_STREAM:
                    reportFlushFailure(sourceId, batch, ex);
                    batch.setSequenceToken(refreshToken(sourceId, batch));
                    return false;
                default:
                    reportFlushFailure(sourceId, batch, ex);
                    if (ex.isRetryable())
                        return false;
                    // the service will never accept this batch, so keep the source moving
                    logger.warn("discarding " + events.size() + " event(s) for source " + sourceId
                                + ": batch was permanently rejected by " + destination);
                    stats.updateEventsDropped(events.size());
                    batches.put(sourceId, batch.successor(batch.getSequenceToken()));
                    return true;
            }
        }
        catch (RuntimeException ex)
        {
            reportFlushFailure(sourceId, batch, ex);
            return false;
        }
    }


    /**
     *  Re-provisions the batch's destination to get its current token. If that
     *  fails, returns the batch's existing token.
     */
    private String refreshToken(String sourceId, Batch batch)
    {
        stats.incrementTokenRefreshes();
        try
        {
            String token = provisioner.openStream(batch.getLogGroupName(), batch.getLogStreamName());
            logger.debug("refreshed sequence token for source " + sourceId + " (" + batch.getDestination() + ")");
            return token;
        }
        catch (RuntimeException ex)
        {
            reportError("unable to refresh sequence token for source " + sourceId + " (" + batch.getDestination() + ")", ex);
            return batch.getSequenceToken();
        }
    }


    private void reportFlushFailure(String sourceId, Batch batch, Throwable ex)
    {
        stats.incrementFailedFlushes();
        reportError("failed to submit " + batch.size() + " event(s) for source " + sourceId
                    + " to " + batch.getDestination() + ": " + ex.getMessage(), ex);
    }


    private void reportError(String message, Throwable ex)
    {
        logger.error(message, ex);
        stats.setLastError(message, ex);
    }
}
