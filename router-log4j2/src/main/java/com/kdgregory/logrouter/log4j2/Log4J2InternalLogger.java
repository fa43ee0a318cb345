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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.kdgregory.logrouter.common.util.InternalLogger;


/**
 *  Writes the router's status and error messages to a Log4J 2 logger. The logger
 *  is named for the router, under <code>com.kdgregory.logrouter</code>, so that
 *  individual routers can be configured separately.
 */
public class Log4J2InternalLogger
implements InternalLogger
{
    public final static String LOGGER_PREFIX = "com.kdgregory.logrouter.";

    private Logger logger;


    public Log4J2InternalLogger(String routerName)
    {
        this(LogManager.getLogger(LOGGER_PREFIX + routerName));
    }


    public Log4J2InternalLogger(Logger logger)
    {
        this.logger = logger;
    }


    @Override
    public void debug(String message)
    {
        logger.debug(message);
    }


    @Override
    public void warn(String message)
    {
        logger.warn(message);
    }


    @Override
    public void error(String message, Throwable ex)
    {
        if (ex != null) logger.error(message, ex);
        else            logger.error(message);
    }


    /**
     *  Returns the underlying logger. Exposed for testing.
     */
    public Logger getLogger()
    {
        return logger;
    }
}
