/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.util.Strings;

/**
 * Utility for parsing and accessing the command line options and parameters.
 * <p>
 * An option is any argument starting with {@code -}. An option takes the next argument as its value unless it is one of
 * the declared flags, which never take a value; any other argument is a parameter.
 */
@Immutable
public class CommandLineOptions {

    /**
     * Parse the array of arguments passed to a Java {@code main} method and create a {@link CommandLineOptions} instance.
     *
     * @param args the {@code main} method's parameters; may not be null
     * @param flags the names of the options that take no value, including their prefix (e.g., "{@code -v}")
     * @return the representation of the command line options and parameters; never null
     */
    public static CommandLineOptions parse(String[] args, String... flags) {
        return parse(Arrays.asList(args), new HashSet<>(Arrays.asList(flags)));
    }

    static CommandLineOptions parse(Collection<String> args, Set<String> flags) {
        Map<String, String> options = new HashMap<>();
        List<String> params = new ArrayList<>();
        List<String> optionNames = new ArrayList<>();
        String optionName = null;
        for (String value : args) {
            value = value.trim();
            if (value.startsWith("-") && value.length() > 1) {
                options.put(value, "true");
                optionNames.add(value);
                optionName = flags.contains(value) ? null : value;
            }
            else if (optionName != null) {
                options.put(optionName, value);
                optionName = null;
            }
            else {
                params.add(value);
            }
        }
        return new CommandLineOptions(options, params, optionNames);
    }

    private final Map<String, String> options;
    private final List<String> params;
    private final List<String> orderedOptionNames;

    private CommandLineOptions(Map<String, String> options, List<String> params, List<String> orderedOptionNames) {
        this.options = options;
        this.params = params;
        this.orderedOptionNames = orderedOptionNames;
    }

    /**
     * Determine if the option with one of the given names was used on the command line.
     *
     * @param name the name for the option (e.g., "-v")
     * @param alternativeName an alternative name for the option (e.g., "--verbose"); may be null
     * @return true if the exact option was used, or false otherwise
     */
    public boolean hasOption(String name, String alternativeName) {
        return getOption(name, alternativeName, null) != null;
    }

    /**
     * Obtain the value associated with the option given the name and alternative name of the option, using the supplied default
     * value if none is found.
     *
     * @param name the name for the option (e.g., "-t")
     * @param alternativeName an alternative name for the option; may be null
     * @param defaultValue the value that should be returned if no named option was found
     * @return the value associated with the option, or the default value if none was found
     */
    public String getOption(String name, String alternativeName, String defaultValue) {
        recordOptionUsed(name, alternativeName);
        String result = options.get(name.trim());
        if (result == null && alternativeName != null) {
            result = options.get(alternativeName.trim());
        }
        return result != null ? result : defaultValue;
    }

    protected void recordOptionUsed(String name, String alternativeName) {
        orderedOptionNames.remove(name.trim());
        if (alternativeName != null) {
            orderedOptionNames.remove(alternativeName.trim());
        }
    }

    public boolean getOption(String name, String alternativeName, boolean defaultValue) {
        return Strings.asBoolean(getOption(name, alternativeName, null), defaultValue);
    }

    /**
     * @return the parameters in the order they appeared; never null
     */
    public List<String> getParameters() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Determine whether there were any unknown option names after all possible options have been checked via one of the
     * {@code getOption(String,...)} methods.
     *
     * @return true if there was at least one option that was not checked
     */
    public boolean hasUnknowns() {
        return !orderedOptionNames.isEmpty();
    }

    /**
     * @return the first unknown option, or null if there were no {@link #hasUnknowns() unknown options}
     */
    public String getFirstUnknownOptionName() {
        return orderedOptionNames.isEmpty() ? null : orderedOptionNames.get(0);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(" ");
        options.forEach((opt, val) -> joiner.add(opt).add(val));
        params.forEach(joiner::add);
        return joiner.toString();
    }
}
