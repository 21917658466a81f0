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

/**
 * A stream of tuples that share one {@link BlockSchema}.
 * <p>
 * The {@code next} method returns null once the stream is exhausted. Implementations
 * are free to reuse the returned tuple object between calls, so callers that keep a
 * tuple past the next call must copy it.
 *
 */
public interface Block
{
    void configure(JsonNode json) throws IOException,
            InterruptedException;

    BlockProperties getProperties();

    Tuple next() throws IOException,
            InterruptedException;

    void rewind() throws IOException;

}
