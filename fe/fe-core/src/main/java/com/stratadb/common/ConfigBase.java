// Copyright 2021-present StarRocks, Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     https://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.stratadb.common;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileReader;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static configuration of a node. Subclasses declare public static fields annotated with {@link ConfField},
 * {@link #init(String)} fills them from a properties file in which {@code ${NAME}} is replaced by the system
 * property or environment variable NAME.
 */
public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\{([^}]*)}");

    @Retention(RetentionPolicy.RUNTIME)
    public @interface ConfField {
        /**
         * A mutable config can be changed at runtime by {@link #setMutableConfig(String, String)}.
         * Code reading it must read the field again every time instead of caching the value.
         */
        boolean mutable() default false;

        String comment() default "";

        /**
         * Former names of the config, still accepted in config files and by setMutableConfig.
         * usage: @ConfField(aliases = {"old_name1", "old_name2"})
         */
        String[] aliases() default {};
    }

    private static volatile List<Field> confFields = ImmutableList.of();
    // name or alias -> field
    private static volatile Map<String, Field> fieldsByName = ImmutableMap.of();

    protected Properties props;

    public void init(String propFile) throws Exception {
        registerFields(getClass());
        props = new Properties();
        try (FileReader reader = new FileReader(propFile, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        resolveVariables();
        applyProperties();
        LOG.info("loaded {} configs from {}", props.size(), propFile);
    }

    public static synchronized void registerFields(Class<? extends ConfigBase> clazz) {
        ImmutableList.Builder<Field> fields = ImmutableList.builder();
        Map<String, Field> byName = Maps.newHashMap();
        for (Field field : clazz.getFields()) {
            ConfField anno = field.getAnnotation(ConfField.class);
            if (anno == null) {
                continue;
            }
            fields.add(field);
            byName.put(field.getName(), field);
            for (String alias : anno.aliases()) {
                byName.put(alias, field);
            }
        }
        confFields = fields.build();
        fieldsByName = ImmutableMap.copyOf(byName);
    }

    private void resolveVariables() throws InvalidConfException {
        for (String key : props.stringPropertyNames()) {
            Matcher m = VARIABLE_PATTERN.matcher(props.getProperty(key));
            StringBuffer resolved = new StringBuffer();
            while (m.find()) {
                String name = m.group(1);
                String value = System.getProperty(name, System.getenv(name));
                if (value == null) {
                    throw new InvalidConfException("no such env variable: " + name);
                }
                m.appendReplacement(resolved, Matcher.quoteReplacement(value));
            }
            m.appendTail(resolved);
            props.setProperty(key, resolved.toString());
        }
    }

    private void applyProperties() throws InvalidConfException {
        for (String key : props.stringPropertyNames()) {
            Field field = fieldsByName.get(key);
            if (field == null) {
                LOG.warn("ignore unknown config {}", key);
                continue;
            }
            // the current name wins over an alias set in the same file
            if (!key.equals(field.getName()) && props.containsKey(field.getName())) {
                LOG.warn("config {} is overridden by {}", key, field.getName());
                continue;
            }
            String value = props.getProperty(key).trim();
            if (value.isEmpty()) {
                continue;
            }
            setConfigField(field, value);
        }
    }

    public static void setConfigField(Field field, String value) throws InvalidConfException {
        String trimmed = value.trim();
        try {
            switch (field.getType().getSimpleName()) {
                case "int":
                    field.setInt(null, Integer.parseInt(trimmed));
                    break;
                case "long":
                    field.setLong(null, Long.parseLong(trimmed));
                    break;
                case "double":
                    field.setDouble(null, Double.parseDouble(trimmed));
                    break;
                case "boolean":
                    if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
                        throw new NumberFormatException("not a boolean");
                    }
                    field.setBoolean(null, Boolean.parseBoolean(trimmed));
                    break;
                case "String":
                    field.set(null, trimmed);
                    break;
                default:
                    throw new InvalidConfException("unsupported type " + field.getType().getSimpleName()
                            + " of config " + field.getName());
            }
        } catch (NumberFormatException | IllegalAccessException e) {
            throw new InvalidConfException("invalid value '" + value + "' for config " + field.getName()
                    + ": " + e.getMessage());
        }
    }

    public static synchronized void setMutableConfig(String key, String value) throws InvalidConfException {
        Field field = fieldsByName.get(key);
        if (field == null || !field.getAnnotation(ConfField.class).mutable()) {
            throw new InvalidConfException(ErrorCode.ERROR_CONFIG_NOT_EXIST, key);
        }
        String oldValue = valueOf(field);
        setConfigField(field, value);
        LOG.info("set config {} from {} to {}", field.getName(), oldValue, value);
    }

    /**
     * @return current value of every config by name, in declaration order
     */
    public static Map<String, String> dump() throws InvalidConfException {
        Map<String, String> values = Maps.newLinkedHashMap();
        for (Field field : confFields) {
            values.put(field.getName(), valueOf(field));
        }
        return values;
    }

    /**
     * Rows of name, value, type, mutable, aliases and comment, one per config.
     */
    public static List<List<String>> getConfigInfo() throws InvalidConfException {
        List<List<String>> rows = Lists.newArrayList();
        for (Field field : confFields) {
            ConfField anno = field.getAnnotation(ConfField.class);
            rows.add(Lists.newArrayList(field.getName(), valueOf(field), field.getType().getSimpleName(),
                    String.valueOf(anno.mutable()), Arrays.toString(anno.aliases()), anno.comment()));
        }
        return rows;
    }

    private static String valueOf(Field field) throws InvalidConfException {
        try {
            return String.valueOf(field.get(null));
        } catch (IllegalAccessException e) {
            throw new InvalidConfException("failed to read config " + field.getName() + ": " + e.getMessage());
        }
    }
}
