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

package com.linkedin.rollup.operator;

/**
 * Thrown while a plan is prepared, when an operator's configuration does not fit the
 * schema of its input blocks.
 *
 */
public class PreconditionException extends Exception
{
    private static final long serialVersionUID = 4455297080955040436L;
    private final PreconditionExceptionType exceptionType;

    public PreconditionException(PreconditionExceptionType exceptionType, String message)
    {
        super(message);
        this.exceptionType = exceptionType;
    }

    public PreconditionExceptionType getExceptionType()
    {
        return exceptionType;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("PreconditionException [")
               .append(exceptionType)
               .append("] ")
               .append(getMessage());
        return builder.toString();
    }

}
