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
 * The aggregated measures of one group of the cube. The values are indexed in the order
 * the measures are configured, and are held as long the same way
 * {@link ValueAggregator} reports them.
 *
 */
public final class AggregateRow
{
    private final DimensionKey key;
    private final long[] values;

    public AggregateRow(DimensionKey key, long[] values)
    {
        if (key == null)
            throw new IllegalArgumentException("key is null");

        this.key = key;
        this.values = Arrays.copyOf(values, values.length);
    }

    public DimensionKey getKey()
    {
        return key;
    }

    public long getValue(int index)
    {
        return values[index];
    }

    public long[] getValues()
    {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public int hashCode()
    {
        return 31 * key.hashCode() + Arrays.hashCode(values);
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
        AggregateRow other = (AggregateRow) obj;
        return key.equals(other.key) && Arrays.equals(values, other.values);
    }

    @Override
    public String toString()
    {
        return key + "=" + Arrays.toString(values);
    }
}
