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

package com.linkedin.rollup.io.text;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;

import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;
import org.codehaus.jackson.node.ObjectNode;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.utils.JsonUtils;

public class TestTextBlockWriter
{
    static String readFile(File file) throws IOException
    {
        Reader in = new InputStreamReader(new FileInputStream(file), "UTF-8");
        StringBuilder sb = new StringBuilder();
        try
        {
            char[] buf = new char[4096];
            int n;
            while ((n = in.read(buf)) > 0)
                sb.append(buf, 0, n);
        }
        finally
        {
            in.close();
        }
        return sb.toString();
    }

    private static Tuple tuple(Object... values) throws Exception
    {
        Tuple t = TupleFactory.getInstance().newTuple(values.length);
        for (int i = 0; i < values.length; i++)
            t.set(i, values[i]);
        return t;
    }

    @Test
    public void testWrite() throws Exception
    {
        File file = File.createTempFile("rollup", ".csv");
        file.deleteOnExit();

        BlockSchema schema = new BlockSchema("STRING legal_entity, INT max_rating, LONG total");

        TextBlockWriter writer = new TextBlockWriter();
        writer.open(JsonUtils.createObjectNode("path", file.getPath()), schema);
        writer.write(tuple("A", 7, 100L));
        writer.write(tuple("B, Inc.", -1, -20L));
        writer.write(tuple("say \"hi\"", 0, 0L));
        writer.close();

        Assert.assertEquals(writer.getNumRecords(), 3L);
        Assert.assertEquals(readFile(file),
                            "legal_entity,max_rating,total\n" + "A,7,100\n"
                                    + "\"B, Inc.\",-1,-20\n" + "\"say \"\"hi\"\"\",0,0\n");
    }

    @Test
    public void testSeparatorAndNoHeader() throws Exception
    {
        File file = File.createTempFile("rollup", ".tsv");
        file.deleteOnExit();

        ObjectNode json =
                JsonUtils.createObjectNode("path", file.getPath(), "separator", "\\t", "header", false);
        json.put("lineTerminator", "\\r\\n");

        TextBlockWriter writer = new TextBlockWriter();
        writer.open(json, new BlockSchema("STRING a, STRING b"));
        writer.write(tuple("x\ty", "z"));
        writer.close();

        Assert.assertEquals(readFile(file), "\"x\ty\"\tz\r\n");
    }
}
