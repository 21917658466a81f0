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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.ColumnType;
import com.linkedin.rollup.operator.cube.AggregateRow;
import com.linkedin.rollup.operator.cube.BaseAggregator;
import com.linkedin.rollup.operator.cube.CubeAssembler;
import com.linkedin.rollup.operator.cube.CubeDimensions;
import com.linkedin.rollup.operator.cube.CubeMeasure;
import com.linkedin.rollup.operator.cube.DimensionKey;
import com.linkedin.rollup.operator.cube.GroupingSetExpander;
import com.linkedin.rollup.operator.cube.MetricCombiner;
import com.linkedin.rollup.operator.cube.ValueAggregator;
import com.linkedin.rollup.utils.JsonUtils;
import com.linkedin.rollup.utils.Pair;

/**
 * Computes the cube of the input block: the aggregates of the base level (all
 * dimensions) and of every proper grouping set, where the dimensions outside the
 * grouping set are written as {@link DimensionKey#TOTAL}. The grand total is not
 * produced.
 * <p>
 * The input is aggregated once into base rows. Every subtotal is then derived from the
 * base rows, so the measures must be associative (see
 * {@link com.linkedin.rollup.operator.cube.ValueAggregator}).
 * <p>
 * The output is produced in a deterministic order: base rows first, then the subtotal
 * levels by increasing number of collapsed dimensions, ordered by key within a level.
 *
 */
public class CubeOperator implements TupleOperator
{
    private static final Log LOG = LogFactory.getLog(CubeOperator.class.getName());

    private CubeDimensions dimensions;
    private CubeMeasure[] measures;
    private int numOutputColumns;

    private Iterator<AggregateRow> iterator;

    @Override
    public void setInput(Map<String, Block> input, JsonNode json, BlockProperties props) throws IOException,
            InterruptedException
    {
        Block inputBlock = input.values().iterator().next();
        BlockSchema inputSchema = inputBlock.getProperties().getSchema();
        numOutputColumns = props.getSchema().getNumColumns();

        try
        {
            dimensions = createDimensions(inputSchema, json);
            measures = createMeasures(inputSchema, json);
        }
        catch (PreconditionException e)
        {
            // not expected: the same checks have already run in getPostCondition
            throw new RuntimeException(e);
        }

        int parallelism = JsonUtils.getInt(json, "parallelism", 1);

        ValueAggregator[] aggregators = new ValueAggregator[measures.length];
        for (int i = 0; i < measures.length; i++)
            aggregators[i] = measures[i].getAggregator();

        MetricCombiner combiner = new MetricCombiner(aggregators);
        BaseAggregator baseAggregator = new BaseAggregator(dimensions, measures, combiner);

        long startTime = System.currentTimeMillis();
        long numInput = 0;
        Tuple tuple;
        while ((tuple = inputBlock.next()) != null)
        {
            baseAggregator.processTuple(tuple);
            numInput++;
        }

        List<AggregateRow> baseRows = baseAggregator.getRows();
        LOG.info("CUBE aggregated " + numInput + " input rows into " + baseRows.size()
                + " base rows");

        GroupingSetExpander expander =
                new GroupingSetExpander(dimensions.getNumDimensions());
        List<Pair<DimensionKey, AggregateRow>> contributions = expander.expand(baseRows);

        List<AggregateRow> subtotalRows = combiner.combineAll(contributions, parallelism);
        LOG.info("CUBE combined " + contributions.size() + " contributions over "
                + expander.getNumGroupingSets() + " grouping sets into "
                + subtotalRows.size() + " subtotal rows");

        List<AggregateRow> cube = new CubeAssembler().assemble(baseRows, subtotalRows);
        LOG.info("CUBE produced " + cube.size() + " rows in "
                + (System.currentTimeMillis() - startTime) + " ms");

        iterator = cube.iterator();
    }

    @Override
    public Tuple next() throws IOException,
            InterruptedException
    {
        if (!iterator.hasNext())
            return null;

        AggregateRow row = iterator.next();

        // a new tuple every time, since the cube rows are held in memory downstream
        Tuple output = TupleFactory.getInstance().newTuple(numOutputColumns);
        dimensions.outputKey(row.getKey(), output);

        int idx = dimensions.getNumDimensions();
        for (int i = 0; i < measures.length; i++)
            output.set(idx++, measures[i].getAggregator().output(row.getValue(i)));

        return output;
    }

    @Override
    public PostCondition getPostCondition(Map<String, PostCondition> preConditions,
                                          JsonNode json) throws PreconditionException
    {
        if (preConditions.size() != 1)
            throw new PreconditionException(PreconditionExceptionType.INPUT_BLOCK_NOT_FOUND,
                                            "CUBE expects exactly one input block. Found: "
                                                    + preConditions.keySet());

        BlockSchema inputSchema = preConditions.values().iterator().next().getSchema();

        CubeDimensions dims = createDimensions(inputSchema, json);
        CubeMeasure[] aggs = createMeasures(inputSchema, json);

        if (JsonUtils.getInt(json, "parallelism", 1) < 1)
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "parallelism must be at least 1");

        List<ColumnType> outputColumns = new ArrayList<ColumnType>();
        Set<String> names = new HashSet<String>();
        for (ColumnType type : dims.outputSchema().getColumnTypes())
        {
            names.add(type.getName());
            outputColumns.add(type);
        }

        for (CubeMeasure measure : aggs)
        {
            if (!names.add(measure.getOutputName()))
                throw new PreconditionException(PreconditionExceptionType.DUPLICATE_COLUMN,
                                                "Output column [" + measure.getOutputName()
                                                        + "] is defined more than once");
            outputColumns.add(measure.getOutputColumn());
        }

        BlockSchema outputSchema =
                new BlockSchema(outputColumns.toArray(new ColumnType[outputColumns.size()]));

        return new PostCondition(outputSchema);
    }

    private static CubeDimensions createDimensions(BlockSchema inputSchema, JsonNode json) throws PreconditionException
    {
        String[] names = JsonUtils.asArray(json, "dimensions");
        return new CubeDimensions(inputSchema, names);
    }

    private static CubeMeasure[] createMeasures(BlockSchema inputSchema, JsonNode json) throws PreconditionException
    {
        if (!JsonUtils.has(json, "aggregates") || json.get("aggregates").size() == 0)
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "CUBE requires at least one aggregate");

        JsonNode aggs = json.get("aggregates");
        CubeMeasure[] measures = new CubeMeasure[aggs.size()];
        for (int i = 0; i < measures.length; i++)
            measures[i] = new CubeMeasure(inputSchema, aggs.get(i));

        return measures;
    }
}
