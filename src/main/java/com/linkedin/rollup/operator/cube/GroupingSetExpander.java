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
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.linkedin.rollup.utils.Pair;

/**
 * Enumerates the subtotal grouping sets of a cube and rewrites base keys into their
 * "ancestors", one per grouping set.
 * <p>
 * A grouping set is the list of dimension positions that keep their value; every other
 * position is collapsed. For N dimensions the grouping sets are all combinations of
 * size 1 to N-1, smallest size first and in lexicographic order within a size. This
 * gives 2^N - 2 sets: the base level (size N) is not a subtotal, and the grand total
 * (size 0) is never produced. With a single dimension there is no subtotal level.
 * <p>
 * This class only relabels keys. It never combines measures.
 *
 */
public class GroupingSetExpander
{
    private static final Log LOG = LogFactory.getLog(GroupingSetExpander.class.getName());

    private final int numDimensions;
    private final int[][] groupingSets;

    public GroupingSetExpander(int numDimensions)
    {
        this.numDimensions = numDimensions;
        this.groupingSets = enumerate(numDimensions);

        if (groupingSets.length == 0)
            LOG.info("Cube has a single dimension: only the base level is generated");
    }

    /**
     * Returns the subtotal grouping sets for the given number of dimensions.
     *
     * @param numDimensions
     *            number of dimensions, at least 1
     * @return the retained positions of each grouping set; empty when numDimensions is 1
     */
    public static int[][] enumerate(int numDimensions)
    {
        if (numDimensions < 1)
            throw new IllegalArgumentException("A cube needs at least one dimension. Found: "
                    + numDimensions);

        if (numDimensions > 30)
            throw new IllegalArgumentException("Only up to 30 dimensions are supported. Found: "
                    + numDimensions);

        // no proper, non-empty subset of a single dimension
        if (numDimensions == 1)
            return new int[0][];

        List<int[]> sets = new ArrayList<int[]>((1 << numDimensions) - 2);
        for (int size = 1; size < numDimensions; size++)
            addCombinations(numDimensions, size, sets);

        return sets.toArray(new int[sets.size()][]);
    }

    private static void addCombinations(int n, int size, List<int[]> sets)
    {
        int[] combination = new int[size];
        for (int i = 0; i < size; i++)
            combination[i] = i;

        while (true)
        {
            sets.add(combination.clone());

            // find the rightmost position that can still be advanced
            int pos = size - 1;
            while (pos >= 0 && combination[pos] == n - size + pos)
                pos--;

            if (pos < 0)
                return;

            combination[pos]++;
            for (int i = pos + 1; i < size; i++)
                combination[i] = combination[i - 1] + 1;
        }
    }

    public int getNumDimensions()
    {
        return numDimensions;
    }

    public int[][] getGroupingSets()
    {
        int[][] copy = new int[groupingSets.length][];
        for (int i = 0; i < groupingSets.length; i++)
            copy[i] = groupingSets[i].clone();
        return copy;
    }

    /**
     * Number of subtotal levels, which is 2^N - 2 (0 for a single dimension).
     */
    public int getNumGroupingSets()
    {
        return groupingSets.length;
    }

    /**
     * Rewrites a base key into one key per subtotal grouping set, in grouping set order.
     */
    public DimensionKey[] ancestors(DimensionKey key)
    {
        if (key.size() != numDimensions)
            throw new IllegalArgumentException("Expected a key with " + numDimensions
                    + " dimensions. Found: " + key);
        if (!key.isBase())
            throw new IllegalArgumentException("Only base keys can be expanded. Found: " + key);

        DimensionKey[] ancestors = new DimensionKey[groupingSets.length];
        for (int i = 0; i < groupingSets.length; i++)
            ancestors[i] = key.retain(groupingSets[i]);

        return ancestors;
    }

    /**
     * Pairs every subtotal key of every base row with the base row it came from. The
     * base rows themselves are not part of the result.
     */
    public List<Pair<DimensionKey, AggregateRow>> expand(Collection<AggregateRow> baseRows)
    {
        List<Pair<DimensionKey, AggregateRow>> expanded =
                new ArrayList<Pair<DimensionKey, AggregateRow>>(baseRows.size()
                        * groupingSets.length);

        for (AggregateRow row : baseRows)
        {
            for (DimensionKey ancestor : ancestors(row.getKey()))
                expanded.add(new Pair<DimensionKey, AggregateRow>(ancestor, row));
        }

        return expanded;
    }
}
