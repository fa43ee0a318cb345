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

import java.util.concurrent.atomic.AtomicLong;

import com.kdgregory.logrouter.common.util.InternalLogger;


/**
 *  Periodically flushes every registered source, so that events from a quiet
 *  source are never held longer than the sweep interval.
 *  <p>
 *  This is a <code>Runnable</code>, started on its own thread by {@link CloudWatchRouter}.
 *  {@link #stop} takes effect between sweeps: a sweep that's in progress runs to
 *  completion, because interrupting a submission would leave its outcome unknown.
 */
public class Sweeper
implements Runnable
{
    private BatchRegistry registry;
    private long interval;
    private InternalLogger logger;

    private Object lock = new Object();
    private boolean stopRequested;
    private volatile boolean running;
    private AtomicLong sweepCount = new AtomicLong();


    public Sweeper(BatchRegistry registry, long interval, InternalLogger logger)
    {
        this.registry = registry;
        this.interval = interval;
        this.logger = logger;
    }


    @Override
    public void run()
    {
        running = true;
        logger.debug("sweeper started, interval " + interval + " ms");
        try
        {
            while (waitForNextSweep())
            {
                sweepOnce();
            }
        }
        finally
        {
            running = false;
            synchronized (lock)
            {
                lock.notifyAll();
            }
            logger.debug("sweeper stopped after " + sweepCount.get() + " sweep(s)");
        }
    }


    /**
     *  Performs a single sweep. Exceptions are logged, never thrown, so that one
     *  bad sweep doesn't end the loop. Returns the number of sources that could
     *  not be flushed.
     */
    public int sweepOnce()
    {
        sweepCount.incrementAndGet();
        try
        {
            int failures = registry.flushAll();
            if (failures > 0)
            {
                logger.warn("sweep failed to flush " + failures + " source(s); will retry on next sweep");
            }
            return failures;
        }
        catch (RuntimeException ex)
        {
            logger.error("unexpected exception during sweep", ex);
            return -1;
        }
    }


    /**
     *  Signals the sweeper to stop. Returns immediately.
     */
    public void stop()
    {
        synchronized (lock)
        {
            stopRequested = true;
            lock.notifyAll();
        }
    }


    /**
     *  Waits for the sweeper's thread to leave its loop. Returns <code>true</code>
     *  if it did so within the timeout (or was never running).
     */
    public boolean waitUntilStopped(long timeoutMillis)
    {
        long timeoutAt = System.currentTimeMillis() + timeoutMillis;
        synchronized (lock)
        {
            while (running)
            {
                long remaining = timeoutAt - System.currentTimeMillis();
                if (remaining <= 0)
                    return false;

                try
                {
                    lock.wait(remaining);
                }
                catch (InterruptedException ex)
                {
                    Thread.currentThread().interrupt();
                    return ! running;
                }
            }
        }
        return true;
    }


    public boolean isRunning()
    {
        return running;
    }


    public long getSweepCount()
    {
        return sweepCount.get();
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Sleeps until the next sweep is due. Returns <code>false</code> if the
     *  sweeper has been asked to stop.
     */
    private boolean waitForNextSweep()
    {
        long wakeAt = System.currentTimeMillis() + interval;
        synchronized (lock)
        {
            while (! stopRequested)
            {
                long remaining = wakeAt - System.currentTimeMillis();
                if (remaining <= 0)
                    return true;

                try
                {
                    lock.wait(remaining);
                }
                catch (InterruptedException ex)
                {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return false;
        }
    }
}
