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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Puts the rows of all cube levels into one deterministic sequence: the base level
 * first, then the subtotal levels by increasing number of collapsed dimensions, and
 * within a level by key.
 *
 */
public class CubeAssembler
{
    private static final Log LOG = LogFactory.getLog(CubeAssembler.class.getName());

    private static final Comparator<AggregateRow> BY_KEY = new Comparator<AggregateRow>()
    {
        @Override
        public int compare(AggregateRow r1, AggregateRow r2)
        {
            return r1.getKey().compareTo(r2.getKey());
        }
    };

    /**
     * Orders the rows of the cube.
     *
     * @throws IllegalStateException
     *             if a grand total row is present, or two rows share a key
     */
    public List<AggregateRow> assemble(Collection<AggregateRow> rows)
    {
        List<AggregateRow> cube = new ArrayList<AggregateRow>(rows);
        Collections.sort(cube, BY_KEY);

        int[] levelSizes = null;
        DimensionKey previous = null;
        for (AggregateRow row : cube)
        {
            DimensionKey key = row.getKey();
            if (key.isGrandTotal())
                throw new IllegalStateException("Grand total row " + key
                        + " is not part of the cube");

            if (previous != null && previous.equals(key))
                throw new IllegalStateException("Key " + key + " appears more than once");

            if (levelSizes == null)
                levelSizes = new int[key.size()];
            levelSizes[key.getNumCollapsed()]++;

            previous = key;
        }

        if (LOG.isDebugEnabled() && levelSizes != null)
        {
            for (int i = 0; i < levelSizes.length; i++)
                LOG.debug("Rows with " + i + " collapsed dimensions: " + levelSizes[i]);
        }

        return cube;
    }

    /**
     * Concatenates the base level with the subtotal rows and orders the result.
     */
    public List<AggregateRow> assemble(Collection<AggregateRow> baseRows,
                                       Collection<AggregateRow> subtotalRows)
    {
        List<AggregateRow> all = new ArrayList<AggregateRow>(baseRows.size() + subtotalRows.size());
        all.addAll(baseRows);
        all.addAll(subtotalRows);
        return assemble(all);
    }
}
