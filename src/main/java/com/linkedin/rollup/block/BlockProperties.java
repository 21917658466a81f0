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

import java.util.HashMap;
import java.util.Map;

/**
 * Stores the meta data for a block: its name, schema and the properties of the blocks
 * it was derived from.
 *
 */
public final class BlockProperties
{
    private enum StandardKeys
    {
        NUM_RECORDS_KEY, SOURCE_PATH_KEY
    }

    private final String blockName;
    private final BlockSchema schema;
    private final BlockProperties[] parents;

    private final Map<String, Object> properties = new HashMap<String, Object>();

    public BlockProperties(String blockName, BlockSchema schema, BlockProperties parent)
    {
        this(blockName, schema, parent == null ? null : new BlockProperties[] { parent });
    }

    public BlockProperties(String blockName, BlockSchema schema, BlockProperties[] parents)
    {
        this.blockName = blockName;
        this.schema = schema;
        this.parents = parents;
    }

    public String getBlockName()
    {
        return blockName;
    }

    public BlockSchema getSchema()
    {
        return schema;
    }

    public Long getNumRecords()
    {
        return (Long) properties.get(StandardKeys.NUM_RECORDS_KEY.toString());
    }

    public void setNumRecords(long numRecords)
    {
        properties.put(StandardKeys.NUM_RECORDS_KEY.toString(), numRecords);
    }

    /**
     * Returns the file this block (or the nearest ancestor that has one) was read from.
     */
    public String getSourcePath()
    {
        return (String) get(StandardKeys.SOURCE_PATH_KEY.toString());
    }

    public void setSourcePath(String path)
    {
        properties.put(StandardKeys.SOURCE_PATH_KEY.toString(), path);
    }

    private Object get(String key)
    {
        Object val = properties.get(key);
        if (val != null)
            return val;

        if (parents == null)
            return null;

        for (BlockProperties parent : parents)
        {
            val = parent.get(key);
            if (val != null)
                return val;
        }

        return null;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("BlockProperties [blockName=")
               .append(blockName)
               .append(", schema=")
               .append(schema)
               .append(", properties=")
               .append(properties)
               .append("]");
        return builder.toString();
    }

}
