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

package com.linkedin.rollup.utils;

import java.io.IOException;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.node.ArrayNode;
import org.codehaus.jackson.node.ObjectNode;

/**
 * Various utility methods for operating with Json objects.
 *
 */
public class JsonUtils
{
    private static final ObjectMapper mapper = new ObjectMapper();

    public static ObjectMapper getMapper()
    {
        return mapper;
    }

    public static JsonNode parse(String json) throws IOException
    {
        return mapper.readTree(json);
    }

    public static JsonNode get(JsonNode node, String property)
    {
        JsonNode val = node.get(property);
        if (val == null || val.isNull())
        {
            throw new IllegalArgumentException("Property " + property
                    + " is not defined in " + node);
        }
        return val;
    }

    public static boolean has(JsonNode node, String property)
    {
        return node.has(property) && !node.get(property).isNull();
    }

    public static String getText(JsonNode node, String property, String defaultValue)
    {
        if (!has(node, property))
            return defaultValue;
        return get(node, property).getTextValue();
    }

    public static String getText(JsonNode node, String property)
    {
        return get(node, property).getTextValue();
    }

    public static int getInt(JsonNode node, String property, int defaultValue)
    {
        if (!has(node, property))
            return defaultValue;
        return get(node, property).getIntValue();
    }

    public static boolean getBoolean(JsonNode node, String property, boolean defaultValue)
    {
        if (!has(node, property))
            return defaultValue;
        return get(node, property).getBooleanValue();
    }

    public static String[] asArray(JsonNode parent, String property)
    {
        if (!has(parent, property))
            return null;

        return asArray(get(parent, property));
    }

    public static String[] asArray(JsonNode node)
    {
        if (node == null)
            throw new IllegalArgumentException("Specified JsonNode is null");

        if (node.isArray())
        {
            ArrayNode anode = (ArrayNode) node;
            int nelements = anode.size();
            String[] array = new String[nelements];
            for (int i = 0; i < nelements; i++)
            {
                array[i] = anode.get(i).getTextValue();
            }
            return array;
        }
        else
        {
            return new String[] { node.getTextValue() };
        }
    }

    public static ObjectNode createObjectNode(Object... keyvals)
    {
        ObjectNode node = mapper.createObjectNode();
        for (int i = 0; i < keyvals.length; i += 2)
        {
            if (keyvals[i + 1] instanceof String)
            {
                node.put((String) keyvals[i], (String) keyvals[i + 1]);
            }
            else if (keyvals[i + 1] instanceof Integer)
            {
                int val = (Integer) keyvals[i + 1];
                node.put((String) keyvals[i], val);
            }
            else if (keyvals[i + 1] instanceof Boolean)
            {
                boolean val = (Boolean) keyvals[i + 1];
                node.put((String) keyvals[i], val);
            }
            else
            {
                node.put((String) keyvals[i], (JsonNode) keyvals[i + 1]);
            }
        }

        return node;
    }

    public static ArrayNode createArrayNode(String... items)
    {
        ArrayNode anode = mapper.createArrayNode();
        for (String item : items)
        {
            anode.add(item);
        }
        return anode;
    }
}
