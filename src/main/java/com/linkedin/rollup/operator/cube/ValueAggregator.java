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

/**
 * Stateless, associative and commutative aggregation of values.
 * <p>
 * The steps for aggregation are as follows:
 * <ul>
 * <li>this aggregator provides an initial value (via the {@link #initialValue} method),
 * which is the identity of {@link #combine}.</li>
 *
 * <li>each input value is converted to a long (via the {@link #valueOf} method).</li>
 *
 * <li>it combines the current value with the last aggregate (via the {@link #combine}
 * method) and reports the new aggregate.</li>
 * </ul>
 * <p>
 * Because {@code combine} is associative and commutative, an aggregate of aggregates is
 * the same as the aggregate of all the values underneath, in any order and any grouping.
 * The cube relies on this to compute subtotals from base-level aggregates.
 *
 * @see ValueAggregationType
 * @see ValueAggregatorFactory
 *
 */
public interface ValueAggregator
{
    /**
     * The initial value for aggregation, which leaves any value unchanged when combined
     * with it.
     *
     * @return the initial value for aggregation.
     */
    long initialValue();

    /**
     * Converts an input value (never null) to the long form that is combined.
     *
     * @param currentValue
     *            the input value
     * @return the value as long
     */
    long valueOf(Object currentValue);

    /**
     * Combines the last aggregated value with another value or partial aggregate.
     *
     * @param lastAggregate
     *            previous aggregated value
     * @param value
     *            a value, or an aggregate of values
     * @return aggregated result
     */
    long combine(long lastAggregate, long value);

    /**
     * Output the value in correct data type
     *
     * @param value
     *            the aggregated value as long
     * @return the aggregated value in current data type
     */
    Object output(long value);

    /**
     * The data type of the aggregated value
     *
     * @return the data type of the aggregated value
     */
    DataType outputType();
}
