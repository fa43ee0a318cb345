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

import java.nio.charset.StandardCharsets;


/**
 *  A single log line emitted by a source. Each instance has a timestamp (epoch
 *  milliseconds) and the payload, stored as both a string and UTF-8 encoded bytes.
 *  <p>
 *  Instances are mutable only via {@link #truncate}, which is called before the
 *  event is handed to a batch.
 */
public class LogEvent
{
    private long timestamp;
    private String message;
    private byte[] messageBytes;


    /**
     *  Constructs an instance from a simple string.
     */
    public LogEvent(long timestamp, String message)
    {
        this.timestamp = timestamp;
        this.message = message;
        this.messageBytes = message.getBytes(StandardCharsets.UTF_8);
    }


    /**
     *  Constructs an instance from raw payload bytes, which are decoded as UTF-8.
     *  Invalid sequences are replaced by U+FFFD, so the stored bytes (and size)
     *  are those of the re-encoded message, which is what gets sent.
     */
    public LogEvent(long timestamp, byte[] payload)
    {
        this.timestamp = timestamp;
        this.message = new String(payload, StandardCharsets.UTF_8);
        this.messageBytes = message.getBytes(StandardCharsets.UTF_8);
    }


    /**
     *  Returns the timestamp of the original event.
     */
    public long getTimestamp()
    {
        return timestamp;
    }


    /**
     *  Returns the size of the payload after conversion to UTF-8.
     */
    public int size()
    {
        return messageBytes.length;
    }


    /**
     *  Returns the payload as a string.
     */
    public String getMessage()
    {
        return message;
    }


    /**
     *  Returns the UTF-8 payload bytes.
     */
    public byte[] getBytes()
    {
        return messageBytes;
    }


    /**
     *  Ensures that the payload has no more than the specified number of bytes,
     *  truncating if necessary. This won't break a UTF-8 character sequence, but
     *  isn't smart enough to recognize code points that consist of multiple UTF-8
     *  sequences. Results are indeterminate for invalid UTF-8.
     */
    public void truncate(int maxSize)
    {
        if (size() <= maxSize)
            return;

        // start past the boundary and back up over continuation bytes
        int idx = maxSize;
        int curFlag = 0;
        while (idx > 0)
        {
            curFlag = messageBytes[idx] & 0x00C0;
            if (curFlag != 0x0080)
                break;
            idx--;
        }

        // at this point we're at an ASCII character or a UTF-8 start character;
        // the latter isn't part of the result
        if (curFlag == 0x00C0)
            idx--;

        int newSize = Math.min(maxSize, idx + 1);
        byte[] newBytes = new byte[newSize];
        System.arraycopy(messageBytes, 0, newBytes, 0, newSize);
        messageBytes = newBytes;
        message = new String(messageBytes, StandardCharsets.UTF_8);
    }


    @Override
    public String toString()
    {
        return "LogEvent[timestamp=" + timestamp + ", size=" + messageBytes.length + "]";
    }
}
