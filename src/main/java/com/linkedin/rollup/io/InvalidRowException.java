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

/**
 * An input row that cannot be turned into a tuple of the block schema. Carries the file
 * and the 1-based line number of the row.
 *
 */
public class InvalidRowException extends IOException
{
    private static final long serialVersionUID = -4416420346437346537L;

    private final String file;
    private final long lineNumber;

    public InvalidRowException(String message, String file, long lineNumber)
    {
        super(message + " [" + file + ":" + lineNumber + "]");
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public InvalidRowException(String message, String file, long lineNumber, Throwable cause)
    {
        this(message, file, lineNumber);
        initCause(cause);
    }

    public String getFile()
    {
        return file;
    }

    public long getLineNumber()
    {
        return lineNumber;
    }
}
