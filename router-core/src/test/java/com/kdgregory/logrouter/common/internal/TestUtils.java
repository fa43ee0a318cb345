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

import java.lang.reflect.Method;

import org.junit.Test;
import static org.junit.Assert.*;

import static net.sf.kdgcommons.test.StringAsserts.*;


public class TestUtils
{
    private final static String FACTORY_NAME = TestUtils.class.getName() + ".createClient";

    // targets for findFullyQualifiedMethod()

    public static String createClient()
    {
        return "default";
    }

    public static String createClient(String region)
    {
        return "client for " + region;
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testHostnameStripsProcessId() throws Exception
    {
        String hostname = Utils.hostname();

        assertFalse("not empty (was: " + hostname + ")",    Utils.isBlank(hostname));
        assertFalse("no PID (was: " + hostname + ")",       hostname.contains("@"));
    }


    @Test
    public void testIsBlank() throws Exception
    {
        assertTrue("null",              Utils.isBlank(null));
        assertTrue("empty",             Utils.isBlank(""));
        assertFalse("whitespace",       Utils.isBlank("  "));
        assertFalse("text",             Utils.isBlank("argle"));
    }


    @Test
    public void testFindMethodByOverload() throws Exception
    {
        Method noArgs = Utils.findFullyQualifiedMethod(FACTORY_NAME);
        assertEquals("no-arg overload",     "default",                  noArgs.invoke(null));

        Method oneArg = Utils.findFullyQualifiedMethod(FACTORY_NAME, String.class);
        assertEquals("one-arg overload",    "client for us-east-2",     oneArg.invoke(null, "us-east-2"));
    }


    @Test
    public void testFindInheritedPublicMethod() throws Exception
    {
        Method method = Utils.findFullyQualifiedMethod(TestUtils.class.getName() + ".hashCode");
        assertEquals("declaring class",     Object.class,   method.getDeclaringClass());
    }


    @Test
    public void testFindMethodWithoutClassName() throws Exception
    {
        try
        {
            Utils.findFullyQualifiedMethod("createClient");
            fail("should have thrown");
        }
        catch (IllegalArgumentException ex)
        {
            assertRegex("message (was: " + ex.getMessage() + ")", "invalid method name: createClient", ex.getMessage());
        }
    }


    @Test(expected=ClassNotFoundException.class)
    public void testFindMethodInMissingClass() throws Exception
    {
        Utils.findFullyQualifiedMethod("com.example.NoSuchFactory.createClient");
    }


    @Test(expected=NoSuchMethodException.class)
    public void testFindMissingMethod() throws Exception
    {
        Utils.findFullyQualifiedMethod(TestUtils.class.getName() + ".bogus");
    }


    @Test(expected=NoSuchMethodException.class)
    public void testFindMethodWithWrongParameters() throws Exception
    {
        Utils.findFullyQualifiedMethod(FACTORY_NAME, Integer.class);
    }
}
