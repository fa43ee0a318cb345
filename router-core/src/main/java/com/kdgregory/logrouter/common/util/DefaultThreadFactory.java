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

package com.kdgregory.logrouter.common.util;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.atomic.AtomicInteger;


/**
 *  The standard {@link ThreadFactory}: runs each task on a new daemon thread, so
 *  that the router never keeps the host's JVM alive.
 */
public class DefaultThreadFactory
implements ThreadFactory
{
    private static AtomicInteger threadNumber = new AtomicInteger(0);

    private String routerName;


    public DefaultThreadFactory(String routerName)
    {
        this.routerName = routerName;
    }


    @Override
    public Thread startThread(Runnable task, String taskName, UncaughtExceptionHandler exceptionHandler)
    {
        Thread thread = createThread(task, taskName, exceptionHandler);
        thread.start();
        return thread;
    }


    /**
     *  Creates and initializes the thread. Exposed so that tests can inspect it.
     */
    protected Thread createThread(Runnable task, String taskName, UncaughtExceptionHandler exceptionHandler)
    {
        Thread thread = new Thread(task);
        thread.setName("com-kdgregory-logrouter-" + routerName + "-" + taskName + "-" + threadNumber.incrementAndGet());
        thread.setPriority(Thread.NORM_PRIORITY);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(exceptionHandler);
        return thread;
    }
}
