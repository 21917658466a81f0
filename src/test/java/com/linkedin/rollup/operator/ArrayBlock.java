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

import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;
import org.codehaus.jackson.JsonNode;
import org.testng.Assert;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.ColumnType;
import com.linkedin.rollup.block.DataType;

/**
 * A block over rows held in memory. Like the file blocks, it reuses a single tuple.
 */
public class ArrayBlock implements Block
{
    private Iterator<Object[]> iterator;
    private final Tuple tuple;
    private final List<Object[]> rows;
    private final BlockProperties props;

    public ArrayBlock(List<Object[]> rows, String[] colNames)
    {
        this(rows, colNames, "block");
    }

    public ArrayBlock(List<Object[]> rows, String[] colNames, String blockName)
    {
        this(rows, inferSchema(rows, colNames), blockName);
    }

    public ArrayBlock(List<Object[]> rows, BlockSchema schema, String blockName)
    {
        this.rows = rows;
        iterator = rows.iterator();
        props = new BlockProperties(blockName, schema, (BlockProperties) null);
        tuple = TupleFactory.getInstance().newTuple(schema.getNumColumns());
    }

    private static BlockSchema inferSchema(List<Object[]> rows, String[] colNames)
    {
        ColumnType[] columnTypes = new ColumnType[colNames.length];
        for (int i = 0; i < colNames.length; i++)
        {
            DataType type = DataType.INT;
            if (rows.size() > 0)
            {
                type = DataType.getDataType(rows.get(0)[i]);
                if (type == DataType.UNKNOWN)
                    throw new IllegalArgumentException("Undefined type for column " + colNames[i]);
            }
            columnTypes[i] = new ColumnType(colNames[i], type);
        }

        return new BlockSchema(columnTypes);
    }

    @Override
    public void configure(JsonNode json)
    {

    }

    @Override
    public Tuple next() throws IOException,
            InterruptedException
    {
        if (!iterator.hasNext())
            return null;

        Object[] row = iterator.next();
        int ncols = row.length;
        for (int i = 0; i < ncols; i++)
        {
            tuple.set(i, row[i]);
        }
        return tuple;
    }

    @Override
    public void rewind() throws IOException
    {
        iterator = rows.iterator();
    }

    @Override
    public BlockProperties getProperties()
    {
        return props;
    }

    public static void assertData(Block block, Object[][] expected, String[] colNames) throws IOException,
            InterruptedException
    {
        Tuple tuple;
        int count = 0;
        int ncols = colNames.length;

        while ((tuple = block.next()) != null)
        {
            Assert.assertTrue(count < expected.length, "Unexpected row " + tuple);
            for (int i = 0; i < ncols; i++)
            {
                Assert.assertEquals(tuple.get(i),
                                    expected[count][i],
                                    String.format("Row %d, column %d. Expected=%s. Found=%s",
                                                  count,
                                                  i,
                                                  Arrays.toString(expected[count]),
                                                  tuple));
            }
            count++;
        }

        Assert.assertEquals(count, expected.length);
    }
}
