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

import java.util.Arrays;

/**
 * The values of the cube dimensions for one group, in dimension order.
 * <p>
 * A dimension can be "collapsed", which is the OLAP "all" semantics: the group spans
 * every value of that dimension. Collapsed positions are stored as null, so they can
 * never be confused with an actual value, and are rendered as {@link #TOTAL} on output.
 * A key with no collapsed position is a base key.
 * <p>
 * Keys are immutable. They order first by the number of collapsed dimensions, then
 * position by position, where an actual value sorts before a collapsed one and actual
 * values compare as strings.
 *
 */
public final class DimensionKey implements Comparable<DimensionKey>
{
    /** Output value of a collapsed dimension. */
    public static final String TOTAL = "Total";

    private final String[] values;
    private final int numCollapsed;

    /**
     * Creates a base key.
     *
     * @param values
     *            the actual value of each dimension, none of them null
     */
    public DimensionKey(String... values)
    {
        for (int i = 0; i < values.length; i++)
        {
            if (values[i] == null)
                throw new IllegalArgumentException("Value of dimension " + i
                        + " is null in base key " + Arrays.toString(values));
        }

        this.values = Arrays.copyOf(values, values.length);
        this.numCollapsed = 0;
    }

    private DimensionKey(String[] values, int numCollapsed)
    {
        this.values = values;
        this.numCollapsed = numCollapsed;
    }

    /**
     * Returns a new key that keeps the values at the retained positions and collapses
     * all others.
     *
     * @param retained
     *            the dimension positions to keep, in increasing order
     */
    public DimensionKey retain(int[] retained)
    {
        String[] rewritten = new String[values.length];
        for (int index : retained)
        {
            if (index < 0 || index >= values.length)
                throw new IllegalArgumentException("Dimension position " + index
                        + " is out of range for key " + this);
            rewritten[index] = values[index];
        }

        int collapsed = 0;
        for (String value : rewritten)
        {
            if (value == null)
                collapsed++;
        }

        return new DimensionKey(rewritten, collapsed);
    }

    public int size()
    {
        return values.length;
    }

    /**
     * Returns the actual value at the position, or null if the dimension is collapsed.
     */
    public String get(int index)
    {
        return values[index];
    }

    public boolean isCollapsed(int index)
    {
        return values[index] == null;
    }

    /**
     * Returns the value as written out: the actual value, or {@link #TOTAL}.
     */
    public String getOutputValue(int index)
    {
        return values[index] == null ? TOTAL : values[index];
    }

    public int getNumCollapsed()
    {
        return numCollapsed;
    }

    public boolean isBase()
    {
        return numCollapsed == 0;
    }

    /**
     * True if every dimension is collapsed (the grand total).
     */
    public boolean isGrandTotal()
    {
        return numCollapsed == values.length;
    }

    @Override
    public int compareTo(DimensionKey other)
    {
        if (numCollapsed != other.numCollapsed)
            return numCollapsed < other.numCollapsed ? -1 : 1;

        int n = Math.min(values.length, other.values.length);
        for (int i = 0; i < n; i++)
        {
            String mine = values[i];
            String theirs = other.values[i];

            if (mine == null && theirs == null)
                continue;
            if (mine == null)
                return 1;
            if (theirs == null)
                return -1;

            int cmp = mine.compareTo(theirs);
            if (cmp != 0)
                return cmp;
        }

        return values.length - other.values.length;
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        DimensionKey other = (DimensionKey) obj;
        return Arrays.equals(values, other.values);
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder("(");

        for (int i = 0; i < values.length; i++)
        {
            b.append(getOutputValue(i));
            if (i != values.length - 1)
                b.append(",");
        }

        return b.append(")").toString();
    }
}
