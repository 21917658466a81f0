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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.operator.PreconditionException;

public class TestValueAggregators
{
    private long aggregate(ValueAggregator agg, Object... values)
    {
        long result = agg.initialValue();
        for (Object value : values)
            result = agg.combine(result, agg.valueOf(value));
        return result;
    }

    @Test
    public void testIntegerMaxAgg() throws PreconditionException
    {
        ValueAggregator agg = ValueAggregatorFactory.get(ValueAggregationType.MAX, DataType.INT, "rating");

        long max = aggregate(agg, 100, 100, 101, 0, -1);
        Assert.assertEquals(agg.output(max), 101);
        Assert.assertEquals(agg.outputType(), DataType.INT);
    }

    @Test
    public void testNegativeMaxAgg() throws PreconditionException
    {
        ValueAggregator agg = ValueAggregatorFactory.get(ValueAggregationType.MAX, DataType.LONG, "rating");

        long max = aggregate(agg, -5L, -3L, -9L);
        Assert.assertEquals(agg.output(max), -3L);
        Assert.assertEquals(agg.outputType(), DataType.LONG);
    }

    @Test
    public void testSumAgg() throws PreconditionException
    {
        ValueAggregator agg = ValueAggregatorFactory.get(ValueAggregationType.SUM, DataType.INT, "value");

        long sum = aggregate(agg, 100, -30, Integer.MAX_VALUE);
        Assert.assertEquals(agg.output(sum), 70L + Integer.MAX_VALUE);
        Assert.assertEquals(agg.outputType(), DataType.LONG);
    }

    @Test
    public void testInitialValueIsIdentity() throws PreconditionException
    {
        for (ValueAggregationType type : ValueAggregationType.values())
        {
            ValueAggregator agg = ValueAggregatorFactory.get(type, DataType.LONG, "value");
            for (long value : new long[] { Long.MIN_VALUE + 1, -7, 0, 42 })
                Assert.assertEquals(agg.combine(agg.initialValue(), value), value, type.toString());
        }
    }

    @Test
    public void testCombineIsAssociative() throws PreconditionException
    {
        long[] values = { 3, -8, 12, 0, 5 };
        for (ValueAggregationType type : ValueAggregationType.values())
        {
            ValueAggregator agg = ValueAggregatorFactory.get(type, DataType.LONG, "value");
            for (long a : values)
                for (long b : values)
                    for (long c : values)
                    {
                        Assert.assertEquals(agg.combine(agg.combine(a, b), c),
                                            agg.combine(a, agg.combine(b, c)));
                        Assert.assertEquals(agg.combine(a, b), agg.combine(b, a));
                    }
        }
    }

    @Test(expectedExceptions = ArithmeticException.class)
    public void testSumOverflow() throws PreconditionException
    {
        ValueAggregator agg = ValueAggregatorFactory.get(ValueAggregationType.SUM, DataType.LONG, "value");

        aggregate(agg, Long.MAX_VALUE - 10, 11L);
    }

    @Test(expectedExceptions = PreconditionException.class)
    public void testStringInputIsRejected() throws PreconditionException
    {
        ValueAggregatorFactory.get(ValueAggregationType.SUM, DataType.STRING, "status");
    }
}
