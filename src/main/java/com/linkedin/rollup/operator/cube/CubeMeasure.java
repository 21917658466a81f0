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

import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.ColumnType;
import com.linkedin.rollup.operator.PreconditionException;
import com.linkedin.rollup.operator.PreconditionExceptionType;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * One measure of the cube: an input column aggregated into an output column with a
 * {@link ValueAggregator}, optionally restricted to the rows where another column
 * equals a given value.
 * <p>
 * Configured with json such as:
 *
 * <pre>
 * {"type": "SUM", "input": "value", "output": "ARAP_total_value",
 *  "filter": {"column": "status", "equals": "ARAP"}}
 * </pre>
 *
 * A row rejected by the filter still belongs to its group and contributes 0. A filter is
 * therefore only accepted on SUM.
 *
 */
public class CubeMeasure
{
    private final String outputName;
    private final ValueAggregationType type;
    private final ValueAggregator aggregator;

    // the index of the column to aggregate in the input tuple
    private final int valueIndex;

    // the index of the filter column in the input tuple, -1 if there is no filter
    private final int filterIndex;
    private final String filterValue;

    public CubeMeasure(BlockSchema inputSchema, JsonNode json) throws PreconditionException
    {
        String typeName = JsonUtils.getText(json, "type");
        try
        {
            type = ValueAggregationType.valueOf(typeName.toUpperCase());
        }
        catch (IllegalArgumentException e)
        {
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "Unknown aggregation type " + typeName);
        }

        String inColName = JsonUtils.getText(json, "input");
        valueIndex = indexOf(inputSchema, inColName);
        outputName = JsonUtils.getText(json, "output");

        aggregator =
                ValueAggregatorFactory.get(type,
                                           inputSchema.getType(valueIndex),
                                           inColName);

        if (JsonUtils.has(json, "filter"))
        {
            if (type != ValueAggregationType.SUM)
                throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                                "A filter is only supported on SUM. Found: "
                                                        + type + "(" + inColName + ")");

            JsonNode filter = json.get("filter");
            filterIndex = indexOf(inputSchema, JsonUtils.getText(filter, "column"));
            filterValue = JsonUtils.getText(filter, "equals");
        }
        else
        {
            filterIndex = -1;
            filterValue = null;
        }
    }

    private static int indexOf(BlockSchema schema, String colName) throws PreconditionException
    {
        if (!schema.hasIndex(colName))
            throw new PreconditionException(PreconditionExceptionType.COLUMN_NOT_PRESENT,
                                            "Column [" + colName + "] is not present in "
                                                    + schema);
        return schema.getIndex(colName);
    }

    /**
     * Returns the contribution of the tuple to this measure.
     */
    public long extract(Tuple tuple) throws ExecException
    {
        if (filterIndex >= 0 && !filterValue.equals(tuple.get(filterIndex)))
            return aggregator.initialValue();

        Object value = tuple.get(valueIndex);
        if (value == null)
            throw new IllegalArgumentException("Value of measure " + outputName
                    + " is null in tuple " + tuple);

        return aggregator.valueOf(value);
    }

    public ValueAggregator getAggregator()
    {
        return aggregator;
    }

    public String getOutputName()
    {
        return outputName;
    }

    public ColumnType getOutputColumn()
    {
        return new ColumnType(outputName, aggregator.outputType());
    }
}
