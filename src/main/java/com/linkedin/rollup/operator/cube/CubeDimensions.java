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

package com.linkedin.rollup.operator.cube;

import java.util.HashSet;
import java.util.Set;

import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;

import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.ColumnType;
import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.operator.PreconditionException;
import com.linkedin.rollup.operator.PreconditionExceptionType;

/**
 * Manages the dimensions for the CUBE operator.
 * <p>
 * The primary capabilities provided by this class are:
 * <ul>
 * <li>Extracting the dimensions from the input tuple (via the
 * {@link #extractDimensionKey} method)</li>
 *
 * <li>Writing back the dimensions into a tuple (via the {@link #outputKey} method), with
 * collapsed dimensions written as {@link DimensionKey#TOTAL}.</li>
 * </ul>
 * The order of the dimensions is fixed at construction and is the order of the values
 * in every {@link DimensionKey} and of the dimension columns in the output.
 *
 */
public class CubeDimensions
{
    private final String[] names;

    // the index of dimension columns in the input tuple
    private final int[] inputIndex;

    public CubeDimensions(BlockSchema inputSchema, String[] dimensions) throws PreconditionException
    {
        if (dimensions == null || dimensions.length == 0)
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "CUBE requires at least one dimension");

        names = dimensions.clone();
        inputIndex = new int[names.length];

        Set<String> seen = new HashSet<String>();
        for (int i = 0; i < names.length; i++)
        {
            String dim = names[i];
            if (!seen.add(dim))
                throw new PreconditionException(PreconditionExceptionType.DUPLICATE_COLUMN,
                                                "Dimension [" + dim + "] is repeated");

            if (!inputSchema.hasIndex(dim))
                throw new PreconditionException(PreconditionExceptionType.COLUMN_NOT_PRESENT,
                                                "Dimension [" + dim + "] is not present in "
                                                        + inputSchema);

            inputIndex[i] = inputSchema.getIndex(dim);

            DataType type = inputSchema.getType(inputIndex[i]);
            if (type != DataType.STRING && !type.isIntOrLong())
                throw new PreconditionException(PreconditionExceptionType.INVALID_DIMENSION_TYPE,
                                                "Dimension [" + dim
                                                        + "] must be STRING, INT or LONG. Found: "
                                                        + type);
        }
    }

    public int getNumDimensions()
    {
        return names.length;
    }

    public String[] getNames()
    {
        return names.clone();
    }

    /**
     * The schema of the dimension columns in the output. Dimensions are always written
     * as strings, since a collapsed dimension holds {@link DimensionKey#TOTAL}.
     */
    public BlockSchema outputSchema()
    {
        ColumnType[] columns = new ColumnType[names.length];
        for (int i = 0; i < names.length; i++)
            columns[i] = new ColumnType(names[i], DataType.STRING);

        return new BlockSchema(columns);
    }

    public DimensionKey extractDimensionKey(Tuple tuple) throws ExecException
    {
        String[] values = new String[inputIndex.length];
        for (int i = 0; i < inputIndex.length; i++)
        {
            Object dim = tuple.get(inputIndex[i]);
            if (dim == null)
                throw new IllegalArgumentException("Dimension " + names[i]
                        + " is null for tuple " + tuple);

            values[i] = dim.toString();
        }

        return new DimensionKey(values);
    }

    /**
     * Writes the key into the first positions of the output tuple.
     */
    public void outputKey(DimensionKey key, Tuple outputTuple) throws ExecException
    {
        for (int dim = 0; dim < names.length; dim++)
            outputTuple.set(dim, key.getOutputValue(dim));
    }
}
