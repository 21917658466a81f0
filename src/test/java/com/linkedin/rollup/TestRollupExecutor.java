/* (c) 2014 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use
 * this file except in compliance with the License. You may obtain a copy of the
 * License at  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied.
 */

package com.linkedin.rollup;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.codehaus.jackson.JsonNode;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TestRollupExecutor
{
    @Test
    public void testDefaultPlanParameters() throws Exception
    {
        CommandLine cmdLine = RollupExecutor.getCommandLine(new String[0]);
        JsonNode plan = RollupExecutor.getPlan(cmdLine);

        Assert.assertEquals(plan.get("inputs").get(0).get("path").getTextValue(), "dataset1.csv");
        Assert.assertEquals(plan.get("inputs").get(1).get("path").getTextValue(), "dataset2.csv");
        Assert.assertEquals(plan.get("output").get("path").getTextValue(), "output.csv");
    }

    @Test
    public void testParameterPrecedence() throws Exception
    {
        File params = File.createTempFile("rollup", ".properties");
        params.deleteOnExit();
        Writer out = new OutputStreamWriter(new FileOutputStream(params), "UTF-8");
        try
        {
            out.write("facts=from_file.csv\noutput=from_file_out.csv\n");
        }
        finally
        {
            out.close();
        }

        CommandLine cmdLine =
                RollupExecutor.getCommandLine(new String[] { "-f", params.getPath(), "-D",
                        "output=cli.csv" });
        JsonNode plan = RollupExecutor.getPlan(cmdLine);

        Assert.assertEquals(plan.get("inputs").get(0).get("path").getTextValue(), "from_file.csv");
        Assert.assertEquals(plan.get("inputs").get(1).get("path").getTextValue(), "dataset2.csv");
        Assert.assertEquals(plan.get("output").get("path").getTextValue(), "cli.csv");
    }

    @Test
    public void testValuesAreEscaped() throws Exception
    {
        Properties params = new Properties();
        params.setProperty("path", "C:\\data\\\"x\".csv");

        JsonNode plan = RollupExecutor.resolvePlan("{\"path\": \"${path}\"}", params);

        Assert.assertEquals(plan.get("path").getTextValue(), "C:\\data\\\"x\".csv");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnresolvedParameter() throws Exception
    {
        RollupExecutor.resolvePlan("{\"path\": \"${missing}\"}", new Properties());
    }

    @Test
    public void testHelp() throws Exception
    {
        Assert.assertNull(RollupExecutor.getCommandLine(new String[] { "-h" }));
    }
}
