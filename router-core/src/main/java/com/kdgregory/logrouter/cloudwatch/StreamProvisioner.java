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
 *  Ensures that a destination exists and returns the sequence token for the next
 *  write to it.
 */
public interface StreamProvisioner
{
    /**
     *  Creates the log group and stream if they don't already exist (tolerating
     *  concurrent creation), then returns the token that the next write must use:
     *  the stream's current token if it has been written, the empty string if not.
     *  <p>
     *  Calling this for an existing, written stream simply retrieves its current
     *  token; the registry relies on this to repair a broken token chain.
     *
     *  @throws RuntimeException (normally a <code>CloudWatchFacadeException</code>
     *          or <code>RetryManager.TimeoutException</code>) if unable to confirm
     *          the destination. No local state is changed.
     */
    String openStream(String logGroupName, String logStreamName);
}
