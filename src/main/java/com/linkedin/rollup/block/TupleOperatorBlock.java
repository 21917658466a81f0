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

package com.linkedin.rollup.block;

import java.io.IOException;

import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.operator.TupleOperator;

/**
 * Exposes the output of a {@link TupleOperator} as a block, so that it can feed the
 * next operator in the chain.
 *
 */
public class TupleOperatorBlock implements Block
{
    private final TupleOperator operator;
    private final BlockProperties props;
    private long numRecords = 0;

    public TupleOperatorBlock(TupleOperator operator, BlockProperties props)
    {
        this.operator = operator;
        this.props = props;
    }

    @Override
    public void configure(JsonNode json) throws IOException,
            InterruptedException
    {

    }

    @Override
    public BlockProperties getProperties()
    {
        return props;
    }

    @Override
    public Tuple next() throws IOException,
            InterruptedException
    {
        Tuple tuple = operator.next();
        if (tuple == null)
            props.setNumRecords(numRecords);
        else
            numRecords++;

        return tuple;
    }

    @Override
    public void rewind() throws IOException
    {
        throw new UnsupportedOperationException("Operator output cannot be rewound");
    }
}
