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

package com.kdgregory.logrouter.log4j2;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;


public class TestLog4J2InternalLogger
{
    private final static String ROUTER_NAME = "TestLog4J2InternalLogger";

    /**
     *  Retains every event that it receives.
     */
    private static class CapturingAppender
    extends AbstractAppender
    {
        public List<LogEvent> events = Collections.synchronizedList(new ArrayList<LogEvent>());

        public CapturingAppender()
        {
            super("capture", null, (Layout<? extends Serializable>)null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event)
        {
            events.add(event.toImmutable());
        }
    }


    private CapturingAppender appender;
    private Logger coreLogger;

//----------------------------------------------------------------------------
//  JUnit scaffolding
//----------------------------------------------------------------------------

    @Before
    public void setUp()
    {
        appender = new CapturingAppender();
        appender.start();

        coreLogger = (Logger)LogManager.getLogger(Log4J2InternalLogger.LOGGER_PREFIX + ROUTER_NAME);
        coreLogger.addAppender(appender);
        coreLogger.setLevel(Level.DEBUG);
    }


    @After
    public void tearDown()
    {
        coreLogger.removeAppender(appender);
        appender.stop();
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testLoggerName() throws Exception
    {
        Log4J2InternalLogger logger = new Log4J2InternalLogger(ROUTER_NAME);
        assertEquals("com.kdgregory.logrouter.TestLog4J2InternalLogger", logger.getLogger().getName());
    }


    @Test
    public void testLevels() throws Exception
    {
        Log4J2InternalLogger logger = new Log4J2InternalLogger(ROUTER_NAME);
        Exception ex = new RuntimeException("oops");

        logger.debug("debug message");
        logger.warn("warn message");
        logger.error("error message", ex);
        logger.error("error without exception", null);

        assertEquals("number of events",    4,                          appender.events.size());

        assertEquals("event 0 level",       Level.DEBUG,                appender.events.get(0).getLevel());
        assertEquals("event 0 message",     "debug message",            appender.events.get(0).getMessage().getFormattedMessage());

        assertEquals("event 1 level",       Level.WARN,                 appender.events.get(1).getLevel());
        assertEquals("event 1 message",     "warn message",             appender.events.get(1).getMessage().getFormattedMessage());

        assertEquals("event 2 level",       Level.ERROR,                appender.events.get(2).getLevel());
        assertEquals("event 2 message",     "error message",            appender.events.get(2).getMessage().getFormattedMessage());
        assertSame("event 2 exception",     ex,                         appender.events.get(2).getThrown());

        assertEquals("event 3 level",       Level.ERROR,                appender.events.get(3).getLevel());
        assertNull("event 3 exception",                                 appender.events.get(3).getThrown());
    }
}
