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

import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.operator.PreconditionException;
import com.linkedin.rollup.operator.PreconditionExceptionType;

/**
 * Factory class for creating {@link ValueAggregator}.
 *
 */
public class ValueAggregatorFactory
{
    /**
     * Creates {@link ValueAggregator} objects.
     * <p>
     * This method throws {@link PreconditionException} if the data type of the input
     * field is not an integer type (e.g. SUM of string fields).
     *
     * @param type
     *            the type of aggregator
     * @param inputType
     *            the data type of the input values
     * @param colName
     *            the name of the input column
     * @return ValueAggregator object
     * @throws PreconditionException
     */
    public static ValueAggregator get(ValueAggregationType type,
                                      DataType inputType,
                                      String colName) throws PreconditionException
    {
        assertIntegerType(type, colName, inputType);

        switch (type)
        {
        case MAX:
            return new MaxAggregator(inputType);
        case SUM:
            return new SumAggregator();
        default:
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "Unsupported aggregation " + type);
        }
    }

    private static void assertIntegerType(ValueAggregationType aggregator,
                                          String colName,
                                          DataType inputType) throws PreconditionException
    {
        if (inputType.isIntOrLong())
            return;

        String msg =
                String.format("Expected type for %s(%s): int or long. Found: %s",
                              aggregator,
                              colName,
                              inputType);

        throw new PreconditionException(PreconditionExceptionType.INVALID_SCHEMA, msg);
    }

    private ValueAggregatorFactory()
    {

    }

    /**
     * Computes sum of the values. The sum is always reported as long, and a sum outside
     * the range of long throws {@link ArithmeticException}.
     *
     */
    private static final class SumAggregator implements ValueAggregator
    {
        @Override
        public long initialValue()
        {
            return 0L;
        }

        @Override
        public long valueOf(Object currentValue)
        {
            return ((Number) currentValue).longValue();
        }

        @Override
        public long combine(long lastAggregate, long value)
        {
            return Math.addExact(lastAggregate, value);
        }

        @Override
        public Object output(long value)
        {
            return value;
        }

        @Override
        public DataType outputType()
        {
            return DataType.LONG;
        }

        @Override
        public String toString()
        {
            return "SUM";
        }
    }

    /**
     * Computes maximum of the values. The maximum keeps the input type.
     *
     */
    private static final class MaxAggregator implements ValueAggregator
    {
        private final DataType type;

        MaxAggregator(DataType type)
        {
            this.type = type;
        }

        @Override
        public long initialValue()
        {
            return Long.MIN_VALUE;
        }

        @Override
        public long valueOf(Object currentValue)
        {
            return ((Number) currentValue).longValue();
        }

        @Override
        public long combine(long lastAggregate, long value)
        {
            return value > lastAggregate ? value : lastAggregate;
        }

        @Override
        public Object output(long value)
        {
            if (type == DataType.INT)
                return (int) value;
            return value;
        }

        @Override
        public DataType outputType()
        {
            return type;
        }

        @Override
        public String toString()
        {
            return "MAX";
        }
    }
}
