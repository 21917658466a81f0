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

/**
 * Thrown when a group is asked for its aggregates but nothing was ever aggregated into
 * it. Grouping only creates groups for values it has seen, so this always points at a
 * bug in the caller rather than at bad input.
 *
 */
public class EmptyGroupException extends IllegalStateException
{
    private static final long serialVersionUID = -2470733515628424395L;

    public EmptyGroupException(DimensionKey key)
    {
        super("No rows were aggregated into group " + key);
    }
}
