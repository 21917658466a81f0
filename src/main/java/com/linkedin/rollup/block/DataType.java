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

/**
 * Column types understood by the rollup pipeline.
 *
 */
public enum DataType
{
    INT,

    LONG,

    STRING,

    UNKNOWN;

    public boolean isIntOrLong()
    {
        return this == LONG || this == INT;
    }

    public static DataType getDataType(Object obj)
    {
        if (obj instanceof Integer)
            return DataType.INT;
        if (obj instanceof Long)
            return DataType.LONG;
        if (obj instanceof String)
            return DataType.STRING;

        return DataType.UNKNOWN;
    }

    /**
     * Converts the text form of a value into an object of this type.
     *
     * @throws NumberFormatException
     *             if this is an integer type and the text is not an integer
     */
    public Object parse(String text)
    {
        switch (this)
        {
        case INT:
            return Integer.valueOf(text.trim());
        case LONG:
            return Long.valueOf(text.trim());
        case STRING:
            return text;
        default:
            throw new IllegalStateException("Cannot parse values of type " + this);
        }
    }
}
