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
import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

public class TestCubeAssembler
{
    private static AggregateRow row(DimensionKey key, long value)
    {
        return new AggregateRow(key, new long[] { value });
    }

    @Test
    public void testOrder()
    {
        DimensionKey ax = new DimensionKey("A", "X");
        DimensionKey bx = new DimensionKey("B", "X");
        DimensionKey ay = new DimensionKey("A", "Y");

        List<AggregateRow> base = Arrays.asList(row(bx, 1), row(ay, 2), row(ax, 3));
        List<AggregateRow> subtotals =
                Arrays.asList(row(ax.retain(new int[] { 1 }), 4),
                              row(ay.retain(new int[] { 0 }), 5),
                              row(bx.retain(new int[] { 0 }), 6),
                              row(ay.retain(new int[] { 1 }), 7));

        List<String> keys = new ArrayList<String>();
        for (AggregateRow r : new CubeAssembler().assemble(base, subtotals))
            keys.add(r.getKey().toString());

        Assert.assertEquals(keys, Arrays.asList("(A,X)",
                                                "(A,Y)",
                                                "(B,X)",
                                                "(A,Total)",
                                                "(B,Total)",
                                                "(Total,X)",
                                                "(Total,Y)"));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testGrandTotalIsRejected()
    {
        DimensionKey grandTotal = new DimensionKey("A", "X").retain(new int[0]);
        new CubeAssembler().assemble(Arrays.asList(row(grandTotal, 1)));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testDuplicateKeyIsRejected()
    {
        DimensionKey ax = new DimensionKey("A", "X");
        new CubeAssembler().assemble(Arrays.asList(row(ax, 1)), Arrays.asList(row(ax, 2)));
    }
}
