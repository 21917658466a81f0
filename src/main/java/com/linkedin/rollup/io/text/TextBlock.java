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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.io.InvalidRowException;
import com.linkedin.rollup.io.InvalidRowPolicy;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * A block read from a delimited text file.
 * <p>
 * Lines may be terminated by CR, LF or CRLF. Blank lines are ignored. When
 * <code>header</code> is true (the default) the first line names the columns.
 * <p>
 * Invalid rows are handled according to <code>invalidRows</code>: REJECT (default)
 * throws the {@link InvalidRowException}, SKIP logs it and moves to the next line.
 *
 */
public class TextBlock implements Block, Closeable
{
    private static final Log LOG = LogFactory.getLog(TextBlock.class.getName());

    private BlockProperties props;
    private File file;
    private boolean hasHeader;
    private InvalidRowPolicy policy;
    private JsonNode json;

    private TextTupleCreator tupleCreator;
    private BufferedReader reader;
    private long lineNumber;

    private long numRecords;
    private long numSkipped;

    @Override
    public void configure(JsonNode json) throws IOException,
            InterruptedException
    {
        this.json = json;

        String path = JsonUtils.getText(json, "path");
        file = new File(path);
        hasHeader = JsonUtils.getBoolean(json, "header", true);
        policy =
                InvalidRowPolicy.valueOf(JsonUtils.getText(json,
                                                           "invalidRows",
                                                           InvalidRowPolicy.REJECT.name())
                                                  .toUpperCase());

        tupleCreator = new TextTupleCreator();
        tupleCreator.setup(json);

        props =
                new BlockProperties(JsonUtils.getText(json, "name", file.getName()),
                                    tupleCreator.getSchema(),
                                    (BlockProperties) null);
        props.setSourcePath(path);

        open();
    }

    private void open() throws IOException
    {
        reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), "UTF-8"));
        lineNumber = 0;
        numRecords = 0;
        numSkipped = 0;

        if (hasHeader)
        {
            try
            {
                String header = readLine();
                if (header == null)
                    throw new IOException("File " + file + " has no header line");

                tupleCreator.setHeader(header, lineNumber);
            }
            catch (IOException e)
            {
                close();
                throw e;
            }
        }

        LOG.info("Reading " + props.getBlockName() + " from " + file + " with policy "
                + policy);
    }

    // the next non-blank line, or null at the end of file
    private String readLine() throws IOException
    {
        String line;
        while ((line = reader.readLine()) != null)
        {
            lineNumber++;
            if (line.trim().length() > 0)
                return line;
        }
        return null;
    }

    @Override
    public BlockProperties getProperties()
    {
        return props;
    }

    @Override
    public Tuple next() throws IOException,
            InterruptedException
    {
        if (reader == null)
            return null;

        String line;
        while ((line = readLine()) != null)
        {
            try
            {
                Tuple tuple = tupleCreator.create(line, lineNumber);
                numRecords++;
                return tuple;
            }
            catch (InvalidRowException e)
            {
                if (policy == InvalidRowPolicy.REJECT)
                {
                    close();
                    throw e;
                }

                numSkipped++;
                LOG.warn("Skipping invalid row: " + e.getMessage());
            }
        }

        close();
        props.setNumRecords(numRecords);
        if (numSkipped > 0)
            LOG.warn("Skipped " + numSkipped + " invalid rows in " + file);
        LOG.info("Read " + numRecords + " rows from " + file);

        return null;
    }

    public long getNumSkipped()
    {
        return numSkipped;
    }

    public boolean isOpen()
    {
        return reader != null;
    }

    @Override
    public void close() throws IOException
    {
        if (reader != null)
        {
            reader.close();
            reader = null;
        }
    }

    @Override
    public void rewind() throws IOException
    {
        close();
        tupleCreator.setup(json);
        open();
    }
}
