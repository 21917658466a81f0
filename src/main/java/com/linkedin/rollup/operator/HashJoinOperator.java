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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.ColumnType;
import com.linkedin.rollup.block.DataType;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * Inner join of two blocks. The right block is loaded into a hash table on the join
 * keys and the left block is streamed against it. Left rows without a match are
 * dropped.
 * <p>
 * The output has the columns of the left block followed by the columns of the right
 * block, except the right join keys.
 * <p>
 * A key that matches several right rows is handled according to <code>multiMatch</code>:
 * <code>FIRST</code> (default) joins with the first right row loaded for the key,
 * <code>ALL</code> emits one row per matching right row.
 *
 */
public class HashJoinOperator implements TupleOperator
{
    private static final Log LOG = LogFactory.getLog(HashJoinOperator.class.getName());

    public enum MultiMatch
    {
        FIRST, ALL
    }

    private static final String MULTI_MATCH = "multiMatch";

    private Map<Tuple, List<Tuple>> rightBlockHashTable;

    private Block leftBlock;
    private Block rightBlock;

    private String[] leftBlockColumns;
    private String[] rightBlockColumns;
    private int[] leftJoinColumnIndex;
    private int[] rightJoinColumnIndex;

    // the right columns that appear in the output
    private int[] rightOutputIndex;
    private int nLeftColumns;

    private MultiMatch multiMatch;

    private Tuple leftTuple;
    private List<Tuple> matchedRightTuples = Collections.emptyList();
    private int matchPosition;
    private boolean isLeftBlockExhausted = false;

    private Tuple keyTuple;
    private Tuple output;

    private long numLeftRows;
    private long numUnmatchedLeftRows;

    @Override
    public void setInput(Map<String, Block> input, JsonNode root, BlockProperties props) throws IOException,
            InterruptedException
    {
        String leftBlockName = JsonUtils.getText(root, "leftBlock");

        for (String name : input.keySet())
        {
            if (name.equalsIgnoreCase(leftBlockName))
                leftBlock = input.get(name);
            else
                rightBlock = input.get(name);
        }

        if (rightBlock == null)
            throw new IllegalArgumentException("RIGHT block is null for join");
        if (leftBlock == null)
            throw new IllegalArgumentException("LEFT block is null for join");

        BlockSchema leftSchema = leftBlock.getProperties().getSchema();
        BlockSchema rightSchema = rightBlock.getProperties().getSchema();

        readJoinKeys(root);
        multiMatch = getMultiMatch(root);

        leftJoinColumnIndex = new int[leftBlockColumns.length];
        rightJoinColumnIndex = new int[rightBlockColumns.length];
        for (int i = 0; i < leftBlockColumns.length; i++)
        {
            leftJoinColumnIndex[i] = leftSchema.getIndex(leftBlockColumns[i]);
            rightJoinColumnIndex[i] = rightSchema.getIndex(rightBlockColumns[i]);
        }

        BlockSchema rightOutputSchema = rightSchema.getComplementSubset(rightBlockColumns);
        rightOutputIndex = new int[rightOutputSchema.getNumColumns()];
        for (int i = 0; i < rightOutputIndex.length; i++)
            rightOutputIndex[i] = rightSchema.getIndex(rightOutputSchema.getName(i));

        nLeftColumns = leftSchema.getNumColumns();

        // reused for the lookup of every left tuple
        keyTuple = TupleFactory.getInstance().newTuple(leftBlockColumns.length);
        output = TupleFactory.getInstance().newTuple(props.getSchema().getNumColumns());

        long startTime = System.currentTimeMillis();
        createHashTable();
        LOG.info("HashJoinOperator: created hash table with " + rightBlockHashTable.size()
                + " keys in " + (System.currentTimeMillis() - startTime) + " ms");
    }

    private void createHashTable() throws IOException,
            InterruptedException
    {
        rightBlockHashTable = new HashMap<Tuple, List<Tuple>>();

        long count = 0;
        long ignored = 0;
        Tuple t;
        while ((t = rightBlock.next()) != null)
        {
            count++;
            Tuple key = getProjectedKeyTuple(t, rightJoinColumnIndex, true);

            List<Tuple> list = rightBlockHashTable.get(key);
            if (list == null)
            {
                list = new ArrayList<Tuple>(1);
                rightBlockHashTable.put(key, list);
            }
            else if (multiMatch == MultiMatch.FIRST)
            {
                ignored++;
                continue;
            }

            // blocks reuse their tuples, so keep a copy
            list.add(TupleFactory.getInstance().newTuple(t.getAll()));
        }

        LOG.info("HashJoinOperator: loaded " + count + " rows from the right block");

        if (ignored > 0)
            LOG.warn("HashJoinOperator: " + ignored + " right rows repeat a join key "
                    + columnList(rightBlockColumns) + " and are ignored. Use \"" + MULTI_MATCH
                    + "\": \"ALL\" to join with every match");
    }

    @Override
    public Tuple next() throws IOException,
            InterruptedException
    {
        while (!isLeftBlockExhausted && matchPosition == matchedRightTuples.size())
        {
            leftTuple = leftBlock.next();

            if (leftTuple == null)
            {
                isLeftBlockExhausted = true;
                LOG.info("HashJoinOperator: " + numUnmatchedLeftRows + " of " + numLeftRows
                        + " left rows had no match and are dropped");
            }
            else
            {
                numLeftRows++;
                matchedRightTuples = getMatchedRightTuples(leftTuple);
                matchPosition = 0;
                if (matchedRightTuples.isEmpty())
                    numUnmatchedLeftRows++;
            }
        }

        if (isLeftBlockExhausted)
            return null;

        return constructJoinTuple(leftTuple, matchedRightTuples.get(matchPosition++));
    }

    private List<Tuple> getMatchedRightTuples(Tuple leftTuple) throws ExecException
    {
        keyTuple = getProjectedKeyTuple(leftTuple, leftJoinColumnIndex, false);

        List<Tuple> list = rightBlockHashTable.get(keyTuple);
        if (list == null)
            return Collections.emptyList();

        return list;
    }

    Tuple constructJoinTuple(Tuple leftTuple, Tuple rightTuple) throws ExecException
    {
        int idx = 0;
        for (int i = 0; i < nLeftColumns; i++)
            output.set(idx++, leftTuple.get(i));

        for (int i = 0; i < rightOutputIndex.length; i++)
            output.set(idx++, rightTuple.get(rightOutputIndex[i]));

        return output;
    }

    // New objects are created while building the hash table; the lookup key is reused
    Tuple getProjectedKeyTuple(Tuple inputTuple, int[] indices, boolean makeNewObject) throws ExecException
    {
        Tuple tempTuple;

        if (makeNewObject)
            tempTuple = TupleFactory.getInstance().newTuple(indices.length);
        else
            tempTuple = keyTuple;

        for (int i = 0; i < indices.length; i++)
            tempTuple.set(i, inputTuple.get(indices[i]));

        return tempTuple;
    }

    private void readJoinKeys(JsonNode json)
    {
        if (json.has("joinKeys"))
        {
            leftBlockColumns = rightBlockColumns = JsonUtils.asArray(json, "joinKeys");
        }
        else
        {
            leftBlockColumns = JsonUtils.asArray(json, "leftJoinKeys");
            rightBlockColumns = JsonUtils.asArray(json, "rightJoinKeys");
        }
    }

    private static MultiMatch getMultiMatch(JsonNode json)
    {
        return MultiMatch.valueOf(JsonUtils.getText(json, MULTI_MATCH, MultiMatch.FIRST.name())
                                           .toUpperCase());
    }

    private static String columnList(String[] columns)
    {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < columns.length; i++)
        {
            if (i > 0)
                sb.append(",");
            sb.append(columns[i]);
        }
        return sb.append(")").toString();
    }

    @Override
    public PostCondition getPostCondition(Map<String, PostCondition> preConditions,
                                          JsonNode json) throws PreconditionException
    {
        // get the conditions of input blocks
        Map<String, PostCondition> conditions = new HashMap<String, PostCondition>(preConditions);
        String leftBlockName = JsonUtils.getText(json, "leftBlock");
        PostCondition leftCondition = conditions.remove(leftBlockName);
        if (leftCondition == null)
            throw new PreconditionException(PreconditionExceptionType.INPUT_BLOCK_NOT_FOUND,
                                            "Left block " + leftBlockName
                                                    + " is not an input of the join");
        if (conditions.size() != 1)
            throw new PreconditionException(PreconditionExceptionType.INPUT_BLOCK_NOT_FOUND,
                                            "Join expects exactly one right block. Found: "
                                                    + conditions.keySet());
        PostCondition rightCondition = conditions.values().iterator().next();

        readJoinKeys(json);
        if (leftBlockColumns == null || rightBlockColumns == null)
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "Join keys are not specified");
        if (leftBlockColumns.length != rightBlockColumns.length)
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "The number of join keys in the left and the right blocks do not match");

        try
        {
            getMultiMatch(json);
        }
        catch (IllegalArgumentException e)
        {
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "Unknown " + MULTI_MATCH + " value: "
                                                    + JsonUtils.getText(json, MULTI_MATCH));
        }

        BlockSchema leftSchema = leftCondition.getSchema();
        BlockSchema rightSchema = rightCondition.getSchema();

        for (int i = 0; i < leftBlockColumns.length; i++)
        {
            checkColumn(leftSchema, leftBlockColumns[i]);
            checkColumn(rightSchema, rightBlockColumns[i]);

            DataType leftType = leftSchema.getType(leftSchema.getIndex(leftBlockColumns[i]));
            DataType rightType = rightSchema.getType(rightSchema.getIndex(rightBlockColumns[i]));
            if (leftType != rightType)
                throw new PreconditionException(PreconditionExceptionType.INVALID_SCHEMA,
                                                "Join key types do not match: "
                                                        + leftBlockColumns[i] + " is " + leftType
                                                        + ", " + rightBlockColumns[i] + " is "
                                                        + rightType);
        }

        // create block schema
        BlockSchema rightOutputSchema = rightSchema.getComplementSubset(rightBlockColumns);

        Set<String> names = new HashSet<String>();
        for (ColumnType type : leftSchema.getColumnTypes())
            names.add(type.getName());
        for (ColumnType type : rightOutputSchema.getColumnTypes())
        {
            if (!names.add(type.getName()))
                throw new PreconditionException(PreconditionExceptionType.DUPLICATE_COLUMN,
                                                "Column [" + type.getName()
                                                        + "] is present in both blocks of the join");
        }

        BlockSchema outputSchema = leftSchema.append(rightOutputSchema);

        return new PostCondition(outputSchema);
    }

    private static void checkColumn(BlockSchema schema, String column) throws PreconditionException
    {
        if (!schema.hasIndex(column))
            throw new PreconditionException(PreconditionExceptionType.COLUMN_NOT_PRESENT,
                                            "Join key [" + column + "] is not present in "
                                                    + schema);
    }
}
