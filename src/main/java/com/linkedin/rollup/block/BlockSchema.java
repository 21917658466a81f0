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

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.codehaus.jackson.JsonNode;

/**
 * Describes the schema of a block.
 * <p>
 * The description is an ordered list of {@link ColumnType} for the fields in the tuple.
 * A schema can be written as text, for example {@code "STRING legal_entity, INT rating"}.
 *
 */
public class BlockSchema
{
    private final ColumnType[] columnTypes;
    private Map<String, Integer> indexMap;

    public BlockSchema(ColumnType[] columnTypes)
    {
        if (columnTypes == null)
            throw new IllegalArgumentException("input argument is null");

        Set<String> names = new HashSet<String>();
        for (ColumnType type : columnTypes)
        {
            if (!names.add(type.getName()))
                throw new IllegalArgumentException("Column [" + type.getName()
                        + "] is defined more than once");
        }

        this.columnTypes = columnTypes;
    }

    /**
     * Creates the schema from json, which is either the text form of the schema or an
     * array of <code>{"name": .., "type": ..}</code> objects.
     */
    public BlockSchema(JsonNode json)
    {
        this(json.isTextual() ? parse(json.getTextValue()) : fromArray(json));
    }

    public BlockSchema(String str)
    {
        this(parse(str));
    }

    private static ColumnType[] fromArray(JsonNode json)
    {
        int ncols = json.size();
        ColumnType[] columnTypes = new ColumnType[ncols];
        for (int i = 0; i < ncols; i++)
            columnTypes[i] = new ColumnType(json.get(i));
        return columnTypes;
    }

    private static ColumnType[] parse(String str)
    {
        if (str == null)
            throw new IllegalArgumentException("input argument is null");

        String pairs[] = str.split(",");
        ColumnType[] columnTypes = new ColumnType[pairs.length];

        int idx = 0;
        for (String pair : pairs)
        {
            String[] typeName = pair.trim().split("\\s+");
            if (typeName.length != 2)
                throw new IllegalArgumentException("Expected \"<type> <name>\" in schema. Found: ["
                        + pair.trim() + "]");

            DataType type = DataType.valueOf(typeName[0].trim().toUpperCase());
            columnTypes[idx++] = new ColumnType(typeName[1].trim(), type);
        }
        return columnTypes;
    }

    public int getNumColumns()
    {
        return columnTypes.length;
    }

    public String getName(int index)
    {
        return columnTypes[index].getName();
    }

    public DataType getType(int index)
    {
        return columnTypes[index].getType();
    }

    public ColumnType getColumnType(int index)
    {
        return columnTypes[index];
    }

    public ColumnType[] getColumnTypes()
    {
        return columnTypes;
    }

    public boolean hasIndex(String colName)
    {
        return getIndexMap().get(colName) != null;
    }

    public int getIndex(String columnName)
    {
        Integer index = getIndexMap().get(columnName);
        if (index == null)
            throw new IllegalArgumentException("Column [" + columnName
                    + "] is not part of schema : " + toString());

        return index;
    }

    private Map<String, Integer> getIndexMap()
    {
        if (indexMap == null)
        {
            indexMap = new HashMap<String, Integer>();
            int idx = 0;
            for (ColumnType type : columnTypes)
            {
                indexMap.put(type.getName(), idx++);
            }
        }

        return indexMap;
    }

    public String[] getColumnNames()
    {
        String[] colNames = new String[columnTypes.length];
        for (int i = 0; i < colNames.length; i++)
            colNames[i] = columnTypes[i].getName();

        return colNames;
    }

    /**
     * Returns the columns whose names are NOT in the specified array, in the order of
     * this schema.
     */
    public BlockSchema getComplementSubset(String[] subset)
    {
        Set<String> set = new HashSet<String>(Arrays.asList(subset));
        ColumnType[] complement = new ColumnType[getNumColumns() - set.size()];

        int idx = 0;
        for (ColumnType type : columnTypes)
        {
            if (!set.contains(type.getName()))
                complement[idx++] = type;
        }

        return new BlockSchema(complement);
    }

    public BlockSchema append(BlockSchema other)
    {
        ColumnType[] first = this.columnTypes;
        ColumnType[] second = other.columnTypes;

        ColumnType[] append = new ColumnType[first.length + second.length];
        System.arraycopy(first, 0, append, 0, first.length);
        System.arraycopy(second, 0, append, first.length, second.length);

        return new BlockSchema(append);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(columnTypes);
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
        BlockSchema other = (BlockSchema) obj;
        return Arrays.equals(columnTypes, other.columnTypes);
    }

    @Override
    public String toString()
    {
        return Arrays.toString(columnTypes);
    }

}
