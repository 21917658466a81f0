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

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;

import org.apache.commons.lang.StringEscapeUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.io.BlockWriter;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * Writes tuples as delimited text, with an optional header line of column names.
 * <p>
 * Numbers are written as plain integers. Strings that contain the separator, a quote or
 * a line break are quoted as in CSV.
 *
 */
public class TextBlockWriter implements BlockWriter
{
    private static final Log LOG = LogFactory.getLog(TextBlockWriter.class.getName());

    public static final String DEFAULT_LINE_TERMINATOR = "\n";

    private Writer out;
    private String separator;
    private String lineTerminator;
    private String path;
    private long numRecords;

    @Override
    public void open(JsonNode json, BlockSchema schema) throws IOException
    {
        path = JsonUtils.getText(json, "path");
        separator =
                StringEscapeUtils.unescapeJava(JsonUtils.getText(json,
                                                                 "separator",
                                                                 TextTupleCreator.DEFAULT_SEPARATOR));
        lineTerminator =
                StringEscapeUtils.unescapeJava(JsonUtils.getText(json,
                                                                 "lineTerminator",
                                                                 DEFAULT_LINE_TERMINATOR));

        File file = new File(path);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs())
            throw new IOException("Cannot create directory " + parent);

        out = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), "UTF-8"));
        numRecords = 0;

        if (JsonUtils.getBoolean(json, "header", true))
        {
            String[] names = schema.getColumnNames();
            for (int i = 0; i < names.length; i++)
            {
                if (i > 0)
                    out.write(separator);
                out.write(escape(names[i]));
            }
            out.write(lineTerminator);
        }
    }

    @Override
    public void write(Tuple tuple) throws IOException
    {
        for (int i = 0; i < tuple.size(); i++)
        {
            if (i > 0)
                out.write(separator);

            Object field = tuple.get(i);
            if (field != null)
                out.write(escape(field.toString()));
        }
        out.write(lineTerminator);
        numRecords++;
    }

    private String escape(String field)
    {
        if (!",".equals(separator) && field.contains(separator))
            return "\"" + field.replace("\"", "\"\"") + "\"";

        return StringEscapeUtils.escapeCsv(field);
    }

    public long getNumRecords()
    {
        return numRecords;
    }

    @Override
    public void flush() throws IOException
    {
        out.flush();
    }

    @Override
    public void close() throws IOException
    {
        out.close();
        LOG.info("Wrote " + numRecords + " rows to " + path);
    }
}
