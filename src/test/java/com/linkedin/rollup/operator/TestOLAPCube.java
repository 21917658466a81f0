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

package com.linkedin.rollup.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.apache.pig.data.Tuple;
import org.codehaus.jackson.node.ArrayNode;
import org.codehaus.jackson.node.ObjectNode;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.operator.cube.DimensionKey;
import com.linkedin.rollup.utils.JsonUtils;

/***
 * Tests for the CUBE operator with MAX and status filtered SUM measures.
 *
 */
public class TestOLAPCube
{
    private static final String[] COLUMNS =
            { "legal_entity", "counter_party", "tier", "rating", "status", "value" };

    private static final String[] DIMENSIONS = { "legal_entity", "counter_party", "tier" };

    static ObjectNode cubeJson(String[] dimensions, int parallelism)
    {
        ArrayNode aggregates = JsonUtils.getMapper().createArrayNode();
        aggregates.add(JsonUtils.createObjectNode("type",
                                                  "MAX",
                                                  "input",
                                                  "rating",
                                                  "output",
                                                  "max_rating"));
        aggregates.add(JsonUtils.createObjectNode("type",
                                                  "SUM",
                                                  "input",
                                                  "value",
                                                  "output",
                                                  "ARAP_total_value",
                                                  "filter",
                                                  JsonUtils.createObjectNode("column",
                                                                             "status",
                                                                             "equals",
                                                                             "ARAP")));
        aggregates.add(JsonUtils.createObjectNode("type",
                                                  "SUM",
                                                  "input",
                                                  "value",
                                                  "output",
                                                  "ACCR_total_value",
                                                  "filter",
                                                  JsonUtils.createObjectNode("column",
                                                                             "status",
                                                                             "equals",
                                                                             "ACCR")));

        ObjectNode node = JsonUtils.createObjectNode("operator", "CUBE", "parallelism", parallelism);
        node.put("dimensions", JsonUtils.createArrayNode(dimensions));
        node.put("aggregates", aggregates);
        return node;
    }

    static List<Tuple> runCube(Object[][] rows, String[] dimensions, int parallelism) throws Exception
    {
        ObjectNode json = cubeJson(dimensions, parallelism);

        Block block = new ArrayBlock(Arrays.asList(rows), COLUMNS);
        Map<String, Block> input = new HashMap<String, Block>();
        input.put("joined", block);

        Map<String, PostCondition> preConditions = new HashMap<String, PostCondition>();
        preConditions.put("joined", new PostCondition(block.getProperties().getSchema()));

        CubeOperator operator = new CubeOperator();
        BlockSchema outputSchema = operator.getPostCondition(preConditions, json).getSchema();
        operator.setInput(input, json, new BlockProperties("cube", outputSchema, (BlockProperties) null));

        List<Tuple> output = new ArrayList<Tuple>();
        Tuple tuple;
        while ((tuple = operator.next()) != null)
            output.add(tuple);

        return output;
    }

    static List<String> toStrings(List<Tuple> tuples)
    {
        List<String> strings = new ArrayList<String>();
        for (Tuple t : tuples)
            strings.add(t.toString());
        return strings;
    }

    @Test
    public void testCubeOfExample() throws Exception
    {
        Object[][] rows =
                { { "A", "X", "T1", 5, "ARAP", 100L }, { "A", "X", "T1", 7, "ACCR", 50L },
                        { "A", "Y", "T1", 3, "ARAP", 20L } };

        String[] expected =
                new String[] { "(A,X,T1,7,100,50)", "(A,Y,T1,3,20,0)",
                        "(A,X,Total,7,100,50)", "(A,Y,Total,3,20,0)", "(A,Total,T1,7,120,50)",
                        "(Total,X,T1,7,100,50)", "(Total,Y,T1,3,20,0)",
                        "(A,Total,Total,7,120,50)", "(Total,X,Total,7,100,50)",
                        "(Total,Y,Total,3,20,0)", "(Total,Total,T1,7,120,50)" };

        Assert.assertEquals(toStrings(runCube(rows, DIMENSIONS, 1)), Arrays.asList(expected));
    }

    @Test
    public void testOutputSchema() throws Exception
    {
        Map<String, PostCondition> preConditions = new HashMap<String, PostCondition>();
        preConditions.put("joined",
                          new PostCondition(new BlockSchema("STRING legal_entity, STRING counter_party, STRING tier, "
                                  + "INT rating, STRING status, LONG value")));

        BlockSchema schema =
                new CubeOperator().getPostCondition(preConditions, cubeJson(DIMENSIONS, 1))
                                  .getSchema();

        Assert.assertEquals(schema.getColumnNames(),
                            new String[] { "legal_entity", "counter_party", "tier",
                                    "max_rating", "ARAP_total_value", "ACCR_total_value" });
        Assert.assertEquals(schema.getType(0), DataType.STRING);
        Assert.assertEquals(schema.getType(3), DataType.INT);
        Assert.assertEquals(schema.getType(4), DataType.LONG);
        Assert.assertEquals(schema.getType(5), DataType.LONG);
    }

    @Test
    public void testStatusFiltering() throws Exception
    {
        Object[][] rows =
                { { "A", "X", "T1", 1, "ACCR", 30L }, { "A", "X", "T1", 2, "OTHER", 1000L } };

        List<Tuple> output = runCube(rows, DIMENSIONS, 1);
        Tuple base = output.get(0);

        Assert.assertEquals(base.toString(), "(A,X,T1,2,0,30)");
    }

    @Test
    public void testNegativeValues() throws Exception
    {
        Object[][] rows =
                { { "A", "X", "T1", -4, "ARAP", -100L }, { "A", "Y", "T1", -2, "ARAP", 40L } };

        List<String> output = toStrings(runCube(rows, DIMENSIONS, 1));
        Assert.assertTrue(output.contains("(A,Total,T1,-2,-60,0)"), output.toString());
    }

    @Test
    public void testSingleDimensionHasOnlyBaseLevel() throws Exception
    {
        Object[][] rows =
                { { "B", "X", "T1", 5, "ARAP", 10L }, { "A", "X", "T1", 7, "ACCR", 50L },
                        { "A", "Y", "T2", 3, "ARAP", 20L } };

        List<String> output =
                toStrings(runCube(rows, new String[] { "legal_entity" }, 1));

        Assert.assertEquals(output, Arrays.asList("(A,7,20,50)", "(B,5,10,0)"));
    }

    @Test
    public void testRollupIdentity() throws Exception
    {
        Object[][] rows = randomRows(500, new Random(42));
        List<Tuple> output = runCube(rows, DIMENSIONS, 1);

        Set<String> keys = new HashSet<String>();
        int numBase = 0;
        for (Tuple t : output)
        {
            String[] key = { (String) t.get(0), (String) t.get(1), (String) t.get(2) };
            Assert.assertTrue(keys.add(Arrays.toString(key)), "Duplicate key " + t);

            int numTotal = 0;
            for (String value : key)
                if (DimensionKey.TOTAL.equals(value))
                    numTotal++;
            Assert.assertTrue(numTotal < key.length, "Grand total row " + t);
            if (numTotal == 0)
                numBase++;

            // scan the raw rows that match the retained dimensions
            int maxRating = Integer.MIN_VALUE;
            long arap = 0;
            long accr = 0;
            int matched = 0;
            for (Object[] row : rows)
            {
                boolean matches = true;
                for (int d = 0; d < key.length; d++)
                    if (!DimensionKey.TOTAL.equals(key[d]) && !key[d].equals(row[d]))
                        matches = false;

                if (!matches)
                    continue;

                matched++;
                maxRating = Math.max(maxRating, (Integer) row[3]);
                if ("ARAP".equals(row[4]))
                    arap += (Long) row[5];
                else if ("ACCR".equals(row[4]))
                    accr += (Long) row[5];
            }

            Assert.assertTrue(matched > 0, "No input row for " + t);
            Assert.assertEquals(t.get(3), maxRating, t.toString());
            Assert.assertEquals(t.get(4), arap, t.toString());
            Assert.assertEquals(t.get(5), accr, t.toString());
        }

        // every grouping set of every distinct base key is present
        Set<String> expectedKeys = new HashSet<String>();
        int[][] masks = { { 1, 1, 1 }, { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 }, { 1, 1, 0 },
                { 1, 0, 1 }, { 0, 1, 1 } };
        Set<String> baseKeys = new HashSet<String>();
        for (Object[] row : rows)
        {
            baseKeys.add(row[0] + "|" + row[1] + "|" + row[2]);
            for (int[] mask : masks)
            {
                String[] key = new String[3];
                for (int d = 0; d < 3; d++)
                    key[d] = mask[d] == 1 ? (String) row[d] : DimensionKey.TOTAL;
                expectedKeys.add(Arrays.toString(key));
            }
        }

        Assert.assertEquals(keys, expectedKeys);
        Assert.assertEquals(numBase, baseKeys.size());
    }

    @Test
    public void testDeterministicOrder() throws Exception
    {
        Object[][] rows = randomRows(300, new Random(7));
        List<Tuple> output = runCube(rows, DIMENSIONS, 1);

        int previousLevel = 0;
        for (Tuple t : output)
        {
            int level = 0;
            for (int d = 0; d < 3; d++)
                if (DimensionKey.TOTAL.equals(t.get(d)))
                    level++;

            Assert.assertTrue(level >= previousLevel, "Levels out of order at " + t);
            previousLevel = level;
        }

        // reversing the input does not change the output
        List<Object[]> reversed = new ArrayList<Object[]>(Arrays.asList(rows));
        java.util.Collections.reverse(reversed);
        Assert.assertEquals(toStrings(runCube(reversed.toArray(new Object[0][]), DIMENSIONS, 1)),
                            toStrings(output));
    }

    @Test
    public void testParallelCombineMatchesSerial() throws Exception
    {
        Object[][] rows = randomRows(1000, new Random(11));

        List<String> serial = toStrings(runCube(rows, DIMENSIONS, 1));
        List<String> parallel = toStrings(runCube(rows, DIMENSIONS, 4));

        Assert.assertEquals(parallel, serial);
    }

    @Test(expectedExceptions = PreconditionException.class)
    public void testMissingDimension() throws Exception
    {
        Map<String, PostCondition> preConditions = new HashMap<String, PostCondition>();
        preConditions.put("joined", new PostCondition(new BlockSchema("STRING legal_entity, INT rating, "
                + "STRING status, LONG value")));

        new CubeOperator().getPostCondition(preConditions, cubeJson(DIMENSIONS, 1));
    }

    @Test
    public void testStringMeasureIsRejected() throws Exception
    {
        Map<String, PostCondition> preConditions = new HashMap<String, PostCondition>();
        preConditions.put("joined",
                          new PostCondition(new BlockSchema("STRING legal_entity, STRING counter_party, STRING tier, "
                                  + "STRING rating, STRING status, LONG value")));
        try
        {
            new CubeOperator().getPostCondition(preConditions, cubeJson(DIMENSIONS, 1));
            Assert.fail("Expected PreconditionException");
        }
        catch (PreconditionException e)
        {
            Assert.assertEquals(e.getExceptionType(), PreconditionExceptionType.INVALID_SCHEMA);
        }
    }

    @Test
    public void testFilteredMaxIsRejected() throws Exception
    {
        ObjectNode json = cubeJson(DIMENSIONS, 1);
        ((ObjectNode) json.get("aggregates").get(0)).put("filter",
                                                         JsonUtils.createObjectNode("column",
                                                                                    "status",
                                                                                    "equals",
                                                                                    "ARAP"));

        Map<String, PostCondition> preConditions = new HashMap<String, PostCondition>();
        preConditions.put("joined",
                          new PostCondition(new BlockSchema("STRING legal_entity, STRING counter_party, STRING tier, "
                                  + "INT rating, STRING status, LONG value")));
        try
        {
            new CubeOperator().getPostCondition(preConditions, json);
            Assert.fail("Expected PreconditionException");
        }
        catch (PreconditionException e)
        {
            Assert.assertEquals(e.getExceptionType(), PreconditionExceptionType.INVALID_CONFIG);
        }
    }

    static Object[][] randomRows(int n, Random random)
    {
        String[] entities = { "L1", "L2", "L3" };
        String[] parties = { "C1", "C2", "C3", "C4", "C5" };
        String[] tiers = { "1", "2", "3" };
        String[] statuses = { "ARAP", "ACCR", "OTHER" };

        Object[][] rows = new Object[n][];
        for (int i = 0; i < n; i++)
        {
            rows[i] =
                    new Object[] { entities[random.nextInt(entities.length)],
                            parties[random.nextInt(parties.length)],
                            tiers[random.nextInt(tiers.length)], random.nextInt(10),
                            statuses[random.nextInt(statuses.length)],
                            (long) (random.nextInt(2000) - 500) };
        }
        return rows;
    }
}
