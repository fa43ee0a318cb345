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

package com.kdgregory.logrouter.common.internal;

import java.lang.management.ManagementFactory;
import java.lang.reflect.Method;


/**
 *  Static utility functions shared by the router modules.
 */
public class Utils
{
    /**
     *  Returns the local hostname, as reported by the JVM's runtime name
     *  (<code>PID@HOSTNAME</code>), or "unknown" if it can't be determined.
     *  Avoids a DNS lookup.
     */
    public static String hostname()
    {
        String vmName = ManagementFactory.getRuntimeMXBean().getName();
        return (vmName.indexOf('@') > 0)
             ? vmName.substring(vmName.indexOf('@') + 1)
             : "unknown";
    }


    /**
     *  Returns true if the passed string is null or empty.
     */
    public static boolean isBlank(String value)
    {
        return (value == null) || value.isEmpty();
    }


    /**
     *  Finds a static method given its fully-qualified name (eg:
     *  <code>com.example.ClientFactory.createClient</code>) and parameter types.
     *
     *  @throws IllegalArgumentException if unable parse the method name.
     *  @throws ClassNotFoundException if unable to load the specified class.
     *  @throws NoSuchMethodException if unable to find a method with the given parameters.
     */
    public static Method findFullyQualifiedMethod(String name, Class<?>... params)
    throws ClassNotFoundException, NoSuchMethodException
    {
        int methodIdx = (name == null) ? -1 : name.lastIndexOf('.');
        if (methodIdx <= 0)
            throw new IllegalArgumentException("invalid method name: " + name);

        String className = name.substring(0, methodIdx);
        String methodName = name.substring(methodIdx + 1);

        Class<?> klass = Class.forName(className);
        try
        {
            return klass.getDeclaredMethod(methodName, params);
        }
        catch (NoSuchMethodException ex)
        {
            // fall through to inherited public methods; this throws if not found
            return klass.getMethod(methodName, params);
        }
    }
}
