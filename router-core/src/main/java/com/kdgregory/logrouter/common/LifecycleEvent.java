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

package com.kdgregory.logrouter.common;


/**
 *  Notification that a log source has started or stopped emitting. The host
 *  produces these when it attaches to or detaches from a source.
 */
public class LifecycleEvent
{
    public enum Kind
    {
        STARTED,
        STOPPED
    }


    private String sourceId;
    private Kind kind;


    public LifecycleEvent(String sourceId, Kind kind)
    {
        this.sourceId = sourceId;
        this.kind = kind;
    }


    public static LifecycleEvent started(String sourceId)
    {
        return new LifecycleEvent(sourceId, Kind.STARTED);
    }


    public static LifecycleEvent stopped(String sourceId)
    {
        return new LifecycleEvent(sourceId, Kind.STOPPED);
    }


    public String getSourceId()
    {
        return sourceId;
    }


    public Kind getKind()
    {
        return kind;
    }


    @Override
    public String toString()
    {
        return "LifecycleEvent[" + sourceId + ": " + kind + "]";
    }
}
