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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.linkedin.rollup.utils.Pair;

/**
 * Reduces contributions into one {@link AggregateRow} per key, combining each measure
 * with its {@link ValueAggregator}.
 * <p>
 * The same {@link Accumulator} serves the base level (contributions are the values of
 * single input rows) and the subtotal levels (contributions are base-level
 * aggregates). Subtotals are therefore never computed from the raw input.
 * <p>
 * Keys are reduced independently of each other, so the reduction can be sharded by key
 * over several threads with no locking: see {@link #combineAll(List, int)}.
 *
 */
public class MetricCombiner
{
    private static final Log LOG = LogFactory.getLog(MetricCombiner.class.getName());

    private final ValueAggregator[] aggregators;

    public MetricCombiner(ValueAggregator[] aggregators)
    {
        if (aggregators == null || aggregators.length == 0)
            throw new IllegalArgumentException("At least one aggregator is required");

        this.aggregators = aggregators.clone();
    }

    public int getNumMeasures()
    {
        return aggregators.length;
    }

    public Accumulator newAccumulator()
    {
        return new Accumulator();
    }

    /**
     * Combines the contributions of a single key.
     *
     * @throws EmptyGroupException
     *             if there are no contributions
     */
    public AggregateRow combine(DimensionKey key, Collection<AggregateRow> contributions)
    {
        Accumulator accumulator = new Accumulator();
        for (AggregateRow contribution : contributions)
            accumulator.add(contribution.getValues());

        return accumulator.toRow(key);
    }

    /**
     * Combines (key, contribution) pairs into one row per distinct key, in the order the
     * keys are first seen.
     */
    public List<AggregateRow> combineAll(List<Pair<DimensionKey, AggregateRow>> contributions)
    {
        return toRows(reduce(contributions));
    }

    /**
     * Combines (key, contribution) pairs into one row per distinct key, reducing with
     * the given number of threads. The rows are the same as the single threaded
     * {@link #combineAll(List)}, the order of the returned list is not.
     */
    public List<AggregateRow> combineAll(List<Pair<DimensionKey, AggregateRow>> contributions,
                                         int parallelism) throws InterruptedException
    {
        if (parallelism <= 1)
            return combineAll(contributions);

        List<List<Pair<DimensionKey, AggregateRow>>> shards =
                new ArrayList<List<Pair<DimensionKey, AggregateRow>>>(parallelism);
        for (int i = 0; i < parallelism; i++)
            shards.add(new ArrayList<Pair<DimensionKey, AggregateRow>>());

        for (Pair<DimensionKey, AggregateRow> contribution : contributions)
        {
            int shard = (contribution.getFirst().hashCode() & Integer.MAX_VALUE) % parallelism;
            shards.get(shard).add(contribution);
        }

        LOG.info("Combining " + contributions.size() + " contributions in " + parallelism
                + " shards");

        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try
        {
            List<Future<Map<DimensionKey, Accumulator>>> futures =
                    new ArrayList<Future<Map<DimensionKey, Accumulator>>>(parallelism);

            for (final List<Pair<DimensionKey, AggregateRow>> shard : shards)
            {
                futures.add(pool.submit(new Callable<Map<DimensionKey, Accumulator>>()
                {
                    @Override
                    public Map<DimensionKey, Accumulator> call()
                    {
                        return reduce(shard);
                    }
                }));
            }

            List<AggregateRow> rows = new ArrayList<AggregateRow>();
            for (Future<Map<DimensionKey, Accumulator>> future : futures)
                rows.addAll(toRows(future.get()));

            return rows;
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new IllegalStateException("Combine failed", cause);
        }
        finally
        {
            pool.shutdownNow();
        }
    }

    private Map<DimensionKey, Accumulator> reduce(List<Pair<DimensionKey, AggregateRow>> contributions)
    {
        Map<DimensionKey, Accumulator> accumulators =
                new LinkedHashMap<DimensionKey, Accumulator>();

        for (Pair<DimensionKey, AggregateRow> contribution : contributions)
        {
            Accumulator accumulator = accumulators.get(contribution.getFirst());
            if (accumulator == null)
            {
                accumulator = new Accumulator();
                accumulators.put(contribution.getFirst(), accumulator);
            }
            accumulator.add(contribution.getSecond().getValues());
        }

        return accumulators;
    }

    private static List<AggregateRow> toRows(Map<DimensionKey, Accumulator> accumulators)
    {
        List<AggregateRow> rows = new ArrayList<AggregateRow>(accumulators.size());
        for (Map.Entry<DimensionKey, Accumulator> entry : accumulators.entrySet())
            rows.add(entry.getValue().toRow(entry.getKey()));

        return rows;
    }

    /**
     * Running aggregate of one group. Not thread safe: a group is owned by one thread
     * for the duration of a reduction.
     */
    public final class Accumulator
    {
        private final long[] values;
        private long count;

        private Accumulator()
        {
            values = new long[aggregators.length];
            for (int i = 0; i < aggregators.length; i++)
                values[i] = aggregators[i].initialValue();
        }

        /**
         * Adds a contribution: one value (or partial aggregate) per measure.
         */
        public void add(long[] contribution)
        {
            if (contribution.length != values.length)
                throw new IllegalArgumentException("Expected " + values.length
                        + " values. Found: " + contribution.length);

            for (int i = 0; i < values.length; i++)
                values[i] = aggregators[i].combine(values[i], contribution[i]);
            count++;
        }

        /**
         * Adds everything aggregated by another accumulator of the same combiner.
         */
        public void merge(Accumulator other)
        {
            for (int i = 0; i < values.length; i++)
                values[i] = aggregators[i].combine(values[i], other.values[i]);
            count += other.count;
        }

        public long getCount()
        {
            return count;
        }

        /**
         * @throws EmptyGroupException
         *             if nothing was added to this accumulator
         */
        public AggregateRow toRow(DimensionKey key)
        {
            if (count == 0)
                throw new EmptyGroupException(key);

            return new AggregateRow(key, values);
        }
    }
}
