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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;

import com.linkedin.rollup.operator.cube.MetricCombiner.Accumulator;

/**
 * Groups input tuples by their full dimension key and aggregates the measures of each
 * group. This produces the base level of the cube.
 *
 */
public class BaseAggregator
{
    private final CubeDimensions dimensions;
    private final CubeMeasure[] measures;
    private final MetricCombiner combiner;

    private final Map<DimensionKey, Accumulator> groups =
            new LinkedHashMap<DimensionKey, Accumulator>();

    // reused for every tuple
    private final long[] contribution;

    public BaseAggregator(CubeDimensions dimensions,
                          CubeMeasure[] measures,
                          MetricCombiner combiner)
    {
        if (measures.length != combiner.getNumMeasures())
            throw new IllegalArgumentException("Combiner has " + combiner.getNumMeasures()
                    + " measures, expected " + measures.length);

        this.dimensions = dimensions;
        this.measures = measures.clone();
        this.combiner = combiner;
        this.contribution = new long[measures.length];
    }

    public void processTuple(Tuple tuple) throws ExecException
    {
        DimensionKey key = dimensions.extractDimensionKey(tuple);

        Accumulator accumulator = groups.get(key);
        if (accumulator == null)
        {
            accumulator = combiner.newAccumulator();
            groups.put(key, accumulator);
        }

        for (int i = 0; i < measures.length; i++)
            contribution[i] = measures[i].extract(tuple);

        accumulator.add(contribution);
    }

    public int getNumGroups()
    {
        return groups.size();
    }

    /**
     * Returns one row per distinct base key seen so far.
     */
    public List<AggregateRow> getRows()
    {
        List<AggregateRow> rows = new ArrayList<AggregateRow>(groups.size());
        for (Map.Entry<DimensionKey, Accumulator> entry : groups.entrySet())
            rows.add(entry.getValue().toRow(entry.getKey()));

        return rows;
    }
}
