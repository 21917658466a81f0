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

package com.linkedin.rollup.io.text;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringEscapeUtils;
import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.io.InvalidRowException;
import com.linkedin.rollup.io.MalformedRowException;
import com.linkedin.rollup.io.NonNumericFieldException;
import com.linkedin.rollup.utils.JsonUtils;

/**
 *
 * Creates tuples from lines of delimited text. The separator (default comma) is read
 * from the json and may be written with java escapes, for example <code>"\t"</code>.
 * <p>
 * Columns of the schema are located in the line by the header (see {@link #setHeader}),
 * or by position when there is no header. Every field of the schema must be present and
 * non-empty; INT and LONG fields must be integers.
 * <p>
 * The same tuple object is returned for every line.
 *
 */
public class TextTupleCreator
{
    public static final String DEFAULT_SEPARATOR = ",";

    private BlockSchema schema;
    private DataType[] typeArray;
    private String separator = DEFAULT_SEPARATOR;
    private String source;

    // position of each schema column in the line
    private int[] fieldIndex;
    private int minFields;

    private Tuple tuple;

    public void setup(JsonNode json) throws UnsupportedEncodingException
    {
        if (JsonUtils.has(json, "separator"))
        {
            String str = JsonUtils.getText(json, "separator");
            str = StringEscapeUtils.unescapeJava(str);
            byte[] bytes = str.getBytes("UTF-8");
            separator = new String(bytes, "UTF-8");
        }
        if (separator.length() == 0)
            throw new IllegalArgumentException("Separator is empty");

        source = JsonUtils.getText(json, "path", "<unknown>");

        schema = new BlockSchema(JsonUtils.get(json, "schema"));
        typeArray = new DataType[schema.getNumColumns()];
        for (int i = 0; i < schema.getNumColumns(); i++)
            typeArray[i] = schema.getType(i);

        fieldIndex = new int[schema.getNumColumns()];
        for (int i = 0; i < fieldIndex.length; i++)
            fieldIndex[i] = i;
        minFields = fieldIndex.length;

        tuple = TupleFactory.getInstance().newTuple(schema.getNumColumns());
    }

    public BlockSchema getSchema()
    {
        return schema;
    }

    public String getSeparator()
    {
        return separator;
    }

    /**
     * Locates the columns of the schema by name in the header line. Columns of the file
     * that are not in the schema are ignored.
     *
     * @throws MalformedRowException
     *             if a column of the schema is not in the header
     */
    public void setHeader(String headerLine, long lineNumber) throws MalformedRowException
    {
        String[] names = split(headerLine);

        minFields = 0;
        for (int i = 0; i < fieldIndex.length; i++)
        {
            String colName = schema.getName(i);
            int idx = -1;
            for (int j = 0; j < names.length; j++)
            {
                if (colName.equals(names[j]))
                {
                    idx = j;
                    break;
                }
            }

            if (idx < 0)
                throw new MalformedRowException("Column " + colName
                        + " is not present in the header " + headerLine, source, lineNumber);

            fieldIndex[i] = idx;
            minFields = Math.max(minFields, idx + 1);
        }
    }

    public Tuple create(String line, long lineNumber) throws InvalidRowException,
            ExecException
    {
        String[] fields = split(line);

        if (fields.length < minFields)
            throw new MalformedRowException("Expected at least " + minFields
                    + " fields, found " + fields.length, source, lineNumber);

        for (int i = 0; i < fieldIndex.length; i++)
        {
            String field = fields[fieldIndex[i]];
            if (field.length() == 0)
                throw new MalformedRowException("Column " + schema.getName(i) + " is empty",
                                                source,
                                                lineNumber);

            Object obj;
            try
            {
                obj = typeArray[i].parse(field);
            }
            catch (NumberFormatException e)
            {
                throw new NonNumericFieldException(schema.getName(i),
                                                   field,
                                                   source,
                                                   lineNumber,
                                                   e);
            }

            tuple.set(i, obj);
        }

        return tuple;
    }

    // A field enclosed in double quotes may contain the separator, and "" stands for
    // one quote inside it.
    String[] split(String line)
    {
        List<String> fields = new ArrayList<String>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean atFieldStart = true;

        int i = 0;
        while (i < line.length())
        {
            char c = line.charAt(i);
            if (quoted)
            {
                if (c == '"')
                {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"')
                    {
                        field.append('"');
                        i += 2;
                        continue;
                    }
                    quoted = false;
                }
                else
                    field.append(c);
                i++;
            }
            else if (line.startsWith(separator, i))
            {
                fields.add(field.toString());
                field.setLength(0);
                atFieldStart = true;
                i += separator.length();
            }
            else
            {
                if (c == '"' && atFieldStart)
                    quoted = true;
                else
                    field.append(c);
                atFieldStart = false;
                i++;
            }
        }
        fields.add(field.toString());

        return fields.toArray(new String[fields.size()]);
    }
}
