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

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Supplier;


/**
 *  Repeatedly invokes a remote operation until it produces a value or a deadline
 *  passes. Delays between attempts start at an initial value and may double on
 *  each attempt, never exceeding a configured maximum; the last sleep is always
 *  trimmed so that the deadline is honored.
 *  <p>
 *  The operation is a <code>Supplier</code>: returning <code>null</code> means
 *  "try again". Exceptions are passed to a handler, which either rethrows (to
 *  abort) or returns (to retry). On timeout the manager either throws
 *  {@link TimeoutException} or returns <code>null</code>, depending on how it
 *  was constructed.
 *  <p>
 *  If the thread is interrupted while sleeping, the invocation stops retrying
 *  and behaves as if it timed out; the interrupt flag is restored.
 *  <p>
 *  Instances hold no per-call state, so may be shared between threads.
 */
public class RetryManager
{
    private String operationName;
    private Duration initialDelay;
    private Duration maxDelay;
    private boolean isExponential;
    private boolean throwOnTimeout;

    private final static Consumer<RuntimeException> RETHROW = new Consumer<RuntimeException>()
    {
        @Override
        public void accept(RuntimeException ex)
        {
            throw ex;
        }
    };


    /**
     *  Base constructor.
     *
     *  @param  operationName   Identifies the operation in timeout exceptions.
     *  @param  initialDelay    Delay after the first failed attempt.
     *  @param  maxDelay        Upper bound for any single delay.
     *  @param  isExponential   If true, delay doubles after each attempt.
     *  @param  throwOnTimeout  If true, timeout throws; if false, returns null.
     */
    public RetryManager(String operationName, Duration initialDelay, Duration maxDelay, boolean isExponential, boolean throwOnTimeout)
    {
        this.operationName = operationName;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.isExponential = isExponential;
        this.throwOnTimeout = throwOnTimeout;
    }


    /**
     *  Convenience constructor: exponential backoff capped at one second, throws
     *  on timeout.
     */
    public RetryManager(String operationName, Duration initialDelay)
    {
        this(operationName, initialDelay, Duration.ofSeconds(1), true, true);
    }


    public String getOperationName()
    {
        return operationName;
    }


    /**
     *  Invokes the operation, passing any exceptions to the provided handler.
     */
    public <T> T invoke(Instant timeoutAt, Supplier<T> operation, Consumer<RuntimeException> exceptionHandler)
    {
        long delay = initialDelay.toMillis();
        long maxDelayMillis = maxDelay.toMillis();
        long deadline = timeoutAt.toEpochMilli();

        while (System.currentTimeMillis() < deadline)
        {
            try
            {
                T result = operation.get();
                if (result != null)
                    return result;
            }
            catch (RuntimeException ex)
            {
                exceptionHandler.accept(ex);
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0)
                break;

            if (! sleepQuietly(Math.min(delay, remaining)))
            {
                Thread.currentThread().interrupt();
                break;
            }

            if (isExponential)
                delay = Math.min(delay * 2, maxDelayMillis);
        }

        if (throwOnTimeout)
            throw new TimeoutException(operationName, timeoutAt, Instant.now());

        return null;
    }


    /**
     *  Invokes the operation, propagating all exceptions.
     */
    public <T> T invoke(Instant timeoutAt, Supplier<T> operation)
    {
        return invoke(timeoutAt, operation, RETHROW);
    }


    /**
     *  Invokes the operation with a relative timeout, passing any exceptions to
     *  the provided handler.
     */
    public <T> T invoke(Duration timeout, Supplier<T> operation, Consumer<RuntimeException> exceptionHandler)
    {
        return invoke(Instant.now().plus(timeout), operation, exceptionHandler);
    }


    /**
     *  Sleeps for the specified number of milliseconds. Returns <code>true</code>
     *  if the sleep completes normally, <code>false</code> if interrupted.
     */
    public static boolean sleepQuietly(long millis)
    {
        try
        {
            Thread.sleep(millis);
            return true;
        }
        catch (InterruptedException ex)
        {
            return false;
        }
    }


    /**
     *  Thrown when an operation does not succeed before its deadline.
     */
    public static class TimeoutException
    extends RuntimeException
    {
        private static final long serialVersionUID = 1L;

        private String operation;
        private Instant expectedTimeout;
        private Instant actualTimeout;

        public TimeoutException(String operation, Instant expectedTimeout, Instant actualTimeout)
        {
            this.operation = operation;
            this.expectedTimeout = expectedTimeout;
            this.actualTimeout = actualTimeout;
        }

        @Override
        public String getMessage()
        {
            return operation + " did not complete by " + expectedTimeout + " (now " + actualTimeout + ")";
        }

        public String getOperation()
        {
            return operation;
        }

        public Instant getExpectedTimeout()
        {
            return expectedTimeout;
        }

        public Instant getActualTimeout()
        {
            return actualTimeout;
        }
    }
}
