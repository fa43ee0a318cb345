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
 *  A log group and stream: where a source's events are written.
 */
public final class Destination
{
    private final String logGroupName;
    private final String logStreamName;


    public Destination(String logGroupName, String logStreamName)
    {
        this.logGroupName = logGroupName;
        this.logStreamName = logStreamName;
    }


    public String getLogGroupName()
    {
        return logGroupName;
    }


    public String getLogStreamName()
    {
        return logStreamName;
    }


    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (! (obj instanceof Destination))
            return false;

        Destination that = (Destination)obj;
        return logGroupName.equals(that.logGroupName)
            && logStreamName.equals(that.logStreamName);
    }


    @Override
    public int hashCode()
    {
        return logGroupName.hashCode() * 31 + logStreamName.hashCode();
    }


    @Override
    public String toString()
    {
        return logGroupName + "/" + logStreamName;
    }
}
