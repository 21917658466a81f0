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

package com.linkedin.rollup.plan.physical;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.node.ObjectNode;

import com.linkedin.rollup.block.Block;
import com.linkedin.rollup.block.BlockProperties;
import com.linkedin.rollup.block.BlockSchema;
import com.linkedin.rollup.block.TupleOperatorBlock;
import com.linkedin.rollup.io.BlockWriter;
import com.linkedin.rollup.io.InvalidRowPolicy;
import com.linkedin.rollup.io.text.TextBlock;
import com.linkedin.rollup.io.text.TextBlockWriter;
import com.linkedin.rollup.operator.OperatorFactory;
import com.linkedin.rollup.operator.OperatorType;
import com.linkedin.rollup.operator.PostCondition;
import com.linkedin.rollup.operator.PreconditionException;
import com.linkedin.rollup.operator.PreconditionExceptionType;
import com.linkedin.rollup.operator.TupleOperator;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * Parses and executes a job plan: loads the input blocks, chains the operators and
 * stores the output block.
 * <p>
 * The plan is checked before any file is read: the output schema of every operator is
 * derived from the schemas of its inputs (see {@link TupleOperator#getPostCondition}).
 *
 */
public class PhaseExecutor
{
    private static final Log LOG = LogFactory.getLog(PhaseExecutor.class.getName());

    private final JsonNode plan;
    private final String name;
    private final InvalidRowPolicy invalidRows;

    private final Map<String, PostCondition> postConditions =
            new LinkedHashMap<String, PostCondition>();
    private final Map<String, Block> blocks = new HashMap<String, Block>();
    private final List<TextBlock> inputs = new ArrayList<TextBlock>();

    private boolean compiled = false;

    public PhaseExecutor(JsonNode plan)
    {
        this.plan = plan;
        this.name = JsonUtils.getText(plan, "name", "rollup");

        String policy = JsonUtils.getText(plan, "invalidRows", InvalidRowPolicy.REJECT.name());
        try
        {
            this.invalidRows = InvalidRowPolicy.valueOf(policy.toUpperCase());
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Unknown invalidRows policy: " + policy, e);
        }
    }

    /**
     * Checks the plan and returns the post condition of the output block.
     */
    public PostCondition compile() throws PreconditionException
    {
        postConditions.clear();

        for (JsonNode input : JsonUtils.get(plan, "inputs"))
        {
            String blockName = JsonUtils.getText(input, "name");
            if (postConditions.containsKey(blockName))
                throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                                "Block " + blockName + " is defined more than once");

            BlockSchema schema;
            try
            {
                schema = new BlockSchema(JsonUtils.get(input, "schema"));
            }
            catch (IllegalArgumentException e)
            {
                throw new PreconditionException(PreconditionExceptionType.INVALID_SCHEMA,
                                                "Block " + blockName + ": " + e.getMessage());
            }
            postConditions.put(blockName, new PostCondition(schema));
        }

        for (JsonNode operatorJson : JsonUtils.get(plan, "operators"))
        {
            TupleOperator operator = createOperator(operatorJson);
            String output = JsonUtils.getText(operatorJson, "output");

            Map<String, PostCondition> preConditions = new LinkedHashMap<String, PostCondition>();
            for (String input : JsonUtils.asArray(JsonUtils.get(operatorJson, "input")))
            {
                PostCondition condition = postConditions.get(input);
                if (condition == null)
                    throw new PreconditionException(PreconditionExceptionType.INPUT_BLOCK_NOT_FOUND,
                                                    "Input block " + input + " of operator "
                                                            + output + " is not defined");
                preConditions.put(input, condition);
            }

            PostCondition condition = operator.getPostCondition(preConditions, operatorJson);
            LOG.info(JsonUtils.getText(operatorJson, "operator") + " " + output + ": "
                    + condition.getSchema());
            postConditions.put(output, condition);
        }

        String outputName = JsonUtils.getText(JsonUtils.get(plan, "output"), "name");
        PostCondition outputCondition = postConditions.get(outputName);
        if (outputCondition == null)
            throw new PreconditionException(PreconditionExceptionType.INPUT_BLOCK_NOT_FOUND,
                                            "Output block " + outputName + " is not defined");

        compiled = true;
        return outputCondition;
    }

    /**
     * Runs the plan.
     *
     * @return the number of rows written to the output
     */
    public long run() throws IOException,
            InterruptedException,
            PreconditionException
    {
        if (!compiled)
            compile();

        long startTime = System.currentTimeMillis();
        LOG.info("Executing " + name);

        long numRecords = 0;
        try
        {
            numRecords = execute();
        }
        finally
        {
            for (TextBlock input : inputs)
                input.close();
        }

        JsonNode outputJson = JsonUtils.get(plan, "output");
        LOG.info("Executed " + name + ": wrote " + numRecords + " rows to "
                + JsonUtils.getText(outputJson, "path") + " in "
                + (System.currentTimeMillis() - startTime) + " ms");

        return numRecords;
    }

    // loads the inputs, chains the operators and writes the output block
    private long execute() throws IOException,
            InterruptedException,
            PreconditionException
    {
        for (JsonNode input : JsonUtils.get(plan, "inputs"))
        {
            ObjectNode blockJson = (ObjectNode) input;
            if (!JsonUtils.has(blockJson, "invalidRows"))
            {
                blockJson = JsonUtils.getMapper().createObjectNode();
                blockJson.putAll((ObjectNode) input);
                blockJson.put("invalidRows", invalidRows.name());
            }

            TextBlock block = new TextBlock();
            block.configure(blockJson);
            inputs.add(block);
            blocks.put(JsonUtils.getText(input, "name"), block);
        }

        for (JsonNode operatorJson : JsonUtils.get(plan, "operators"))
        {
            TupleOperator operator = createOperator(operatorJson);
            String output = JsonUtils.getText(operatorJson, "output");

            Map<String, Block> inputBlocks = getInputBlocks(blocks, operatorJson);
            BlockProperties[] parentProps = new BlockProperties[inputBlocks.size()];
            int idx = 0;
            for (Block parent : inputBlocks.values())
                parentProps[idx++] = parent.getProperties();

            BlockProperties props =
                    new BlockProperties(output,
                                        postConditions.get(output).getSchema(),
                                        parentProps);

            operator.setInput(inputBlocks, operatorJson, props);
            blocks.put(output, new TupleOperatorBlock(operator, props));
        }

        JsonNode outputJson = JsonUtils.get(plan, "output");
        Block outputBlock = blocks.get(JsonUtils.getText(outputJson, "name"));

        BlockWriter writer = new TextBlockWriter();
        writer.open(outputJson, outputBlock.getProperties().getSchema());

        long numRecords = 0;
        try
        {
            Tuple tuple;
            while ((tuple = outputBlock.next()) != null)
            {
                writer.write(tuple);
                numRecords++;
            }
        }
        finally
        {
            writer.close();
        }

        return numRecords;
    }

    private static TupleOperator createOperator(JsonNode operatorJson) throws PreconditionException
    {
        String type = JsonUtils.getText(operatorJson, "operator");
        try
        {
            return OperatorFactory.getTupleOperator(OperatorType.valueOf(type.toUpperCase()));
        }
        catch (IllegalArgumentException e)
        {
            throw new PreconditionException(PreconditionExceptionType.INVALID_CONFIG,
                                            "Unknown operator " + type);
        }
    }

    List<TextBlock> getInputs()
    {
        return inputs;
    }

    Map<String, Block> getInputBlocks(Map<String, Block> allBlocks, JsonNode json)
    {
        Map<String, Block> inputBlocks = new LinkedHashMap<String, Block>();
        String[] inputs = JsonUtils.asArray(json.get("input"));
        for (String input : inputs)
        {
            inputBlocks.put(input, allBlocks.get(input));
        }

        return inputBlocks;
    }
}
