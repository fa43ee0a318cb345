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


/**
 *  Starts the router's background tasks (the sweeper, and optionally a consumer
 *  for lifecycle events).
 *  <p>
 *  In normal operation the router uses {@link DefaultThreadFactory}. Tests may
 *  substitute a factory that records the task without starting it, so that they
 *  can drive it explicitly.
 *  <p>
 *  The caller must provide an uncaught exception handler; a typical handler
 *  logs the exception (recoverable exceptions are handled inside the task).
 */
public interface ThreadFactory
{
    /**
     *  Starts the task, returning the thread that runs it (null if the factory
     *  did not create a thread).
     */
    Thread startThread(Runnable task, String taskName, UncaughtExceptionHandler exceptionHandler);
}
