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

package com.linkedin.rollup;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.codehaus.jackson.JsonNode;

import com.linkedin.rollup.plan.physical.PhaseExecutor;
import com.linkedin.rollup.utils.JsonUtils;

/**
 * Resolves and executes rollup plans.
 * <p>
 * A plan is json in which <code>${name}</code> refers to a parameter. Parameters come
 * from the defaults of the built-in plan, then the <code>-f</code> files (in command
 * line order), then the <code>-D</code> options.
 *
 */
public class RollupExecutor
{
    private static final Log LOG = LogFactory.getLog(RollupExecutor.class.getName());

    public static final String DEFAULT_PLAN = "rollup-default.json";
    public static final String DEFAULT_PARAMS = "rollup-default.properties";

    private static final Pattern PARAMETER = Pattern.compile("\\$\\{([A-Za-z0-9_.\\-]+)\\}");

    public static void main(String[] args) throws Exception
    {
        CommandLine cmdLine = getCommandLine(args);
        if (cmdLine == null)
            return;

        JsonNode plan = getPlan(cmdLine);

        if (cmdLine.hasOption("j"))
        {
            System.out.println(JsonUtils.getMapper()
                                        .writerWithDefaultPrettyPrinter()
                                        .writeValueAsString(plan));
            return;
        }

        long rows = new PhaseExecutor(plan).run();
        LOG.info("Rollup complete: " + rows + " rows");
    }

    static JsonNode getPlan(CommandLine cmdLine) throws IOException
    {
        Properties props = new Properties();
        String planText;

        if (cmdLine.hasOption("c"))
        {
            planText = readFile(new File(cmdLine.getOptionValue("c")));
        }
        else
        {
            planText = readResource(DEFAULT_PLAN);
            loadResource(DEFAULT_PARAMS, props);
        }

        props.putAll(getProperties(cmdLine));

        return resolvePlan(planText, props);
    }

    /**
     * Properties are collected in the following order--
     * <p/>
     * 1. properties passed through -f argument (for multiple order in CLI order)
     * 2. properties passed as -D arguments directly on CLI
     */
    static Properties getProperties(CommandLine cmdLine) throws IOException
    {
        Properties props = new Properties();

        // 1. -f properties
        String[] propFiles = cmdLine.getOptionValues("f");
        if (propFiles != null)
        {
            for (String propFile : propFiles)
            {
                InputStream in = new FileInputStream(propFile);
                try
                {
                    props.load(new InputStreamReader(in, "UTF-8"));
                }
                finally
                {
                    in.close();
                }
            }
        }

        // 2. -D properties
        if (cmdLine.getOptionProperties("D").size() > 0)
        {
            props.putAll(cmdLine.getOptionProperties("D"));
        }
        return props;
    }

    /**
     * Replaces every <code>${name}</code> in the plan text and parses the result.
     *
     * @throws IllegalArgumentException
     *             if a parameter has no value
     */
    public static JsonNode resolvePlan(String planText, Properties params) throws IOException
    {
        Matcher matcher = PARAMETER.matcher(planText);
        StringBuffer sb = new StringBuffer();
        while (matcher.find())
        {
            String name = matcher.group(1);
            String value = params.getProperty(name);
            if (value == null)
                throw new IllegalArgumentException("Parameter " + name + " is not defined");

            // values are substituted inside json strings
            String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"");
            matcher.appendReplacement(sb, Matcher.quoteReplacement(escaped));
        }
        matcher.appendTail(sb);

        return JsonUtils.parse(sb.toString());
    }

    private static String readFile(File file) throws IOException
    {
        return read(new FileInputStream(file));
    }

    private static String readResource(String name) throws IOException
    {
        InputStream in = RollupExecutor.class.getClassLoader().getResourceAsStream(name);
        if (in == null)
            throw new FileNotFoundException("Resource " + name + " is not in the classpath");

        return read(in);
    }

    private static void loadResource(String name, Properties props) throws IOException
    {
        InputStream in = RollupExecutor.class.getClassLoader().getResourceAsStream(name);
        if (in == null)
            return;

        try
        {
            props.load(new InputStreamReader(in, "UTF-8"));
        }
        finally
        {
            in.close();
        }
    }

    private static String read(InputStream in) throws IOException
    {
        BufferedReader breader = new BufferedReader(new InputStreamReader(in, "UTF-8"));
        StringBuilder strBuilder = new StringBuilder();
        try
        {
            String line;
            while ((line = breader.readLine()) != null)
            {
                strBuilder.append(line);
                strBuilder.append("\n");
            }
        }
        finally
        {
            breader.close();
        }

        return strBuilder.toString();
    }

    @SuppressWarnings("static-access")
    static CommandLine getCommandLine(String[] args) throws ParseException
    {
        Options options = new Options();

        options.addOption("j", "json", false, "show the resolved plan in JSON and exit");
        options.addOption("h", "help", false, "shows this message");

        options.addOption(OptionBuilder.withArgName("file")
                                       .hasArg()
                                       .withDescription("use given plan file instead of the default plan")
                                       .withLongOpt("config")
                                       .create("c"));

        options.addOption(OptionBuilder.withArgName("file")
                                       .hasArg()
                                       .withDescription("use given parameter file")
                                       .withLongOpt("param_file")
                                       .create("f"));

        options.addOption(OptionBuilder.withArgName("property=value")
                                       .hasArgs(2)
                                       .withValueSeparator()
                                       .withDescription("use value for given parameter")
                                       .create("D"));

        // create the parser
        CommandLineParser parser = new PosixParser();

        // parse the command line arguments
        CommandLine line = parser.parse(options, args);

        if (line.hasOption("h"))
        {
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("RollupExecutor [options]", options);
            return null;
        }

        return line;
    }
}
