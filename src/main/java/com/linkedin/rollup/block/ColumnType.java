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

import static com.linkedin.rollup.utils.JsonUtils.getText;

import org.codehaus.jackson.JsonNode;

/**
 * Defines the schema of a column: its name and data type.
 *
 */
public class ColumnType
{
    private final String name;

    private final DataType type;

    public ColumnType(JsonNode json)
    {
        this(getText(json, "name"), DataType.valueOf(getText(json, "type").toUpperCase()));
    }

    public ColumnType(String name, DataType type)
    {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Column name is missing");
        if (type == null)
            throw new IllegalArgumentException("Type of column [" + name + "] is missing");

        this.name = name;
        this.type = type;
    }

    public String getName()
    {
        return name;
    }

    public DataType getType()
    {
        return type;
    }

    @Override
    public String toString()
    {
        return String.format("%s %s", type, name);
    }

    @Override
    public int hashCode()
    {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ColumnType other = (ColumnType) obj;
        return name.equals(other.name) && type == other.type;
    }
}
