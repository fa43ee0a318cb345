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
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

import net.sf.kdgcommons.lang.StringUtil;

import com.kdgregory.logrouter.common.LifecycleEvent;
import com.kdgregory.logrouter.common.LogEvent;
import com.kdgregory.logrouter.testhelpers.RecordingIngestor;
import com.kdgregory.logrouter.testhelpers.TestableInternalLogger;


public class TestEventRouter
{
    private List<String> provisioned = new ArrayList<String>();

    private StreamProvisioner provisioner = (group, stream) ->
    {
        if (stream.contains("bogus"))
            throw new IllegalStateException("unable to provision " + group + "/" + stream);
        provisioned.add(group + "/" + stream);
        return "";
    };

    private CloudWatchRouterConfig config = new CloudWatchRouterConfig();
    private RecordingIngestor ingestor = new RecordingIngestor();
    private CloudWatchRouterStatistics stats = new CloudWatchRouterStatistics();
    private TestableInternalLogger logger = new TestableInternalLogger();

    private BatchRegistry registry;
    private EventRouter router;


    private EventRouter router()
    {
        if (router == null)
        {
            registry = new BatchRegistry(provisioner, ingestor, stats, logger);
            router = new EventRouter(registry, new DefaultNameResolver("argle", "bargle-"), config, stats, logger);
        }
        return router;
    }


    private static LogEvent eventOfSize(int size)
    {
        return new LogEvent(System.currentTimeMillis(), StringUtil.repeat('X', size));
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testStartWithResolvedDestination() throws Exception
    {
        router().start("c1");

        assertEquals("provisioned",     Arrays.asList("argle/bargle-c1"),       provisioned);
        assertEquals("destination",     new Destination("argle", "bargle-c1"),  registry.destinationOf("c1"));
    }


    @Test
    public void testStartWithExplicitDestination() throws Exception
    {
        router().start("c1", "foo", "bar");

        assertEquals("destination",     new Destination("foo", "bar"),  registry.destinationOf("c1"));
    }


    @Test
    public void testHandleEvent() throws Exception
    {
        router().start("c1");

        assertTrue("accepted event",            router.handleEvent("c1", new LogEvent(100, "hello")));
        assertEquals("pending events",          1,      registry.pendingEventCount("c1"));
        assertEquals("events accepted",         1,      stats.getEventsAccepted());

        router.stop("c1");

        assertFalse("source removed",                   registry.isRegistered("c1"));
        assertEquals("submissions",             1,      ingestor.submissions.size());
        assertEquals("submitted message", "hello",      ingestor.submissions.get(0).events.get(0).getMessage());
    }


    @Test
    public void testEmptyEventIsDiscarded() throws Exception
    {
        router().start("c1");

        assertFalse("rejected event",           router.handleEvent("c1", new LogEvent(100, "")));
        assertEquals("pending events",          0,      registry.pendingEventCount("c1"));
        logger.assertInternalWarningLog("discarded empty message from source c1");
    }


    @Test
    public void testOversizeEventIsTruncated() throws Exception
    {
        router().start("c1");

        LogEvent event = eventOfSize(CloudWatchConstants.MAX_MESSAGE_SIZE + 1);
        assertTrue("accepted event",            router.handleEvent("c1", event));

        assertEquals("event size",              CloudWatchConstants.MAX_MESSAGE_SIZE,   event.size());
        assertEquals("pending bytes",           CloudWatchConstants.MAX_BATCH_BYTES,    registry.pendingByteCount("c1"));
        assertEquals("oversize messages",       1,                                      stats.getOversizeMessages());
        logger.assertInternalWarningLog("truncated oversize message from source c1 \\(32741 bytes to 32740\\)");
    }


    @Test
    public void testOversizeEventIsDiscardedWhenNotTruncating() throws Exception
    {
        config.setTruncateOversizeMessages(false);
        router().start("c1");

        assertFalse("rejected event",           router.handleEvent("c1", eventOfSize(CloudWatchConstants.MAX_MESSAGE_SIZE + 1)));
        assertTrue("accepted maximum event",    router.handleEvent("c1", eventOfSize(CloudWatchConstants.MAX_MESSAGE_SIZE)));

        assertEquals("pending events",          1,      registry.pendingEventCount("c1"));
        assertEquals("oversize messages",       1,      stats.getOversizeMessages());
        assertEquals("events dropped",          1,      stats.getEventsDropped());
        logger.assertInternalWarningLog("discarded oversize message from source c1 \\(32741 bytes, limit is 32740\\)");
    }


    @Test
    public void testEventForUnknownSource() throws Exception
    {
        assertFalse("rejected event",           router().handleEvent("c1", new LogEvent(100, "hello")));
        assertEquals("unroutable events",       1,      stats.getUnroutableEvents());
    }


    @Test
    public void testLifecycleEvents() throws Exception
    {
        router().onLifecycleEvent(LifecycleEvent.started("c1"));
        assertTrue("registered after start",            registry.isRegistered("c1"));

        router.handleEvent("c1", new LogEvent(100, "hello"));

        router.onLifecycleEvent(LifecycleEvent.stopped("c1"));
        assertFalse("not registered after stop",        registry.isRegistered("c1"));
        assertEquals("pending events were sent",    1,  ingestor.eventCount());
    }


    @Test
    public void testLifecycleEventFailureIsLogged() throws Exception
    {
        // a source whose destination can't be resolved
        router = new EventRouter(
                    new BatchRegistry(provisioner, ingestor, stats, logger),
                    sourceId -> { throw new IllegalArgumentException("no destination for " + sourceId); },
                    config, stats, logger);

        router.onLifecycleEvent(LifecycleEvent.started("c1"));

        logger.assertInternalErrorLog("failed to process LifecycleEvent\\[c1: STARTED\\]");
        logger.assertInternalErrorLogExceptionTypes(IllegalArgumentException.class);
    }


    @Test
    public void testProvisioningFailureStillAdmitsSource() throws Exception
    {
        router().start("bogus");

        assertTrue("registered",                        registry.isRegistered("bogus"));
        assertTrue("accepts events",                    router.handleEvent("bogus", new LogEvent(100, "hello")));
        assertEquals("provisioning failures",   1,      stats.getProvisioningFailures());
    }


    @Test
    public void testConsumeLifecycleEvents() throws Exception
    {
        Iterator<LifecycleEvent> events = Arrays.asList(
                                            LifecycleEvent.started("c1"),
                                            LifecycleEvent.started("c2"),
                                            LifecycleEvent.stopped("c1"))
                                          .iterator();

        assertEquals("events applied",      3,      router().consumeLifecycleEvents(events));
        assertFalse("c1 stopped",                   registry.isRegistered("c1"));
        assertTrue("c2 running",                    registry.isRegistered("c2"));
    }


    @Test
    public void testConsumeLogEvents() throws Exception
    {
        router().start("c1");

        Iterator<LogEvent> events = Arrays.asList(
                                        new LogEvent(100, "first"),
                                        new LogEvent(200, ""),
                                        new LogEvent(300, "third"))
                                    .iterator();

        assertEquals("events accepted",     2,      router.consumeLogEvents("c1", events));
        assertEquals("pending events",      2,      registry.pendingEventCount("c1"));
    }


    @Test
    public void testConsumeStopsWhenInterrupted() throws Exception
    {
        router().start("c1");

        Iterator<LogEvent> events = Arrays.asList(new LogEvent(100, "first"), new LogEvent(200, "second")).iterator();

        Thread.currentThread().interrupt();
        try
        {
            assertEquals("events accepted",     0,      router.consumeLogEvents("c1", events));
            assertTrue("iterator not consumed",         events.hasNext());
        }
        finally
        {
            Thread.interrupted();
        }
    }
}
