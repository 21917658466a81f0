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

/**
 * A field of an INT or LONG column that is not an integer.
 *
 */
public class NonNumericFieldException extends InvalidRowException
{
    private static final long serialVersionUID = -2089157317645262751L;

    private final String column;
    private final String value;

    public NonNumericFieldException(String column,
                                    String value,
                                    String file,
                                    long lineNumber,
                                    NumberFormatException cause)
    {
        super("Column " + column + " is not an integer: \"" + value + "\"",
              file,
              lineNumber,
              cause);
        this.column = column;
        this.value = value;
    }

    public String getColumn()
    {
        return column;
    }

    public String getValue()
    {
        return value;
    }
}
