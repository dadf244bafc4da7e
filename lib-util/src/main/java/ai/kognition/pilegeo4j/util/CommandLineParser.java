/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilegeo4j.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import org.apache.commons.lang3.math.NumberUtils;

/**
 * Builds a map of options from a command line so the options can be looked up by name.
 * <p>
 * {@code java GeoTiffValueAt file.tif -x -122.5 -y 45.25 -verbose} results in:
 * </p>
 *
 * <table border="1">
 * <caption>parsed options</caption>
 * <tr><td><b>name</b></td><td><b>value</b></td></tr>
 * <tr><td>x</td><td>-122.5</td></tr>
 * <tr><td>y</td><td>45.25</td></tr>
 * <tr><td>verbose</td><td>"true"</td></tr>
 * </table>
 *
 * <p>
 * and {@code file.tif} is available from {@link #getNonOptionArgs()}. Unlike a plain
 * dash check, a token that parses as a number is always treated as a value so that negative
 * coordinates can be passed.
 * </p>
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 3810447825631270531L;

    private final int argc;
    private final List<String> noargs = new ArrayList<>();

    /**
     * A null argument list results in an empty map.
     */
    public CommandLineParser(final String[] args) {
        argc = args == null ? 0 : args.length;
        parse(args);
    }

    public int getTotalArgCount() {
        return argc;
    }

    public int getOptionCount() {
        return size();
    }

    public List<String> getNonOptionArgs() {
        return noargs;
    }

    public String getProperty(final String key) {
        return get(key);
    }

    public boolean isSet(final String key) {
        return containsKey(key);
    }

    /**
     * @throws IllegalArgumentException if the option is present but isn't a number.
     */
    public Double getDouble(final String key) {
        final String val = get(key);
        if(val == null)
            return null;
        if(!NumberUtils.isCreatable(val))
            throw new IllegalArgumentException("The value for option -" + key + " (\"" + val + "\") is not a number.");
        return NumberUtils.createDouble(val);
    }

    public int getInt(final String key, final int defaultValue) {
        final String val = get(key);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The value for option -" + key + " (\"" + val + "\") is not an integer.", nfe);
        }
    }

    private static boolean isOption(final String token) {
        return token.length() > 1 && token.charAt(0) == '-' && !NumberUtils.isCreatable(token);
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        for(int i = 0; i < argc; i++) {
            final String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(isOption(cur)) {
                final String key = cur.substring(1);
                String val = null;
                if(i + 1 < argc) {
                    final String next = args[i + 1].trim();
                    // an option followed by another option is a flag
                    if(!next.isEmpty() && !isOption(next)) {
                        val = next;
                        i++;
                    }
                }
                put(key, val == null ? "true" : val);
            } else
                noargs.add(cur);
        }
    }
}
