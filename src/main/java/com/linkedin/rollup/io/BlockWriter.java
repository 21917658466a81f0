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

package com.linkedin.rollup.io;

import java.io.IOException;

import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.BlockSchema;

/**
 * Writes the tuples of a block to a file.
 *
 */
public interface BlockWriter
{
    /**
     * Open a file for writing.
     *
     * @param json
     *            the output section of the plan: <code>path</code> and format options
     * @param schema
     *            the schema of the tuples that will be written
     * @throws IOException
     */
    void open(JsonNode json, BlockSchema schema) throws IOException;

    /**
     * Write a tuple to the file.
     *
     * @param tuple
     * @throws IOException
     */
    void write(Tuple tuple) throws IOException;

    void flush() throws IOException;

    void close() throws IOException;
}
