/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A whitespace-separated argument list with {@code {name}} placeholders. Placeholders are substituted token by
 * token, so a value containing spaces stays a single argument and nothing is ever interpreted by a shell.
 *
 * @author Brendan McCarthy
 */
public final class CommandTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9_]*)}");

    private final String text;
    private final List<String> tokens;

    private CommandTemplate(String text, List<String> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    public static CommandTemplate parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty command template");
        }
        return new CommandTemplate(trimmed, Collections.unmodifiableList(Arrays.asList(trimmed.split("\\s+"))));
    }

    /**
     * Substitutes every placeholder.
     *
     * @param values by placeholder name
     * @return argument list
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public List<String> expand(Map<String, String> values) {
        List<String> args = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Matcher matcher = PLACEHOLDER.matcher(token);
            StringBuffer sb = new StringBuffer();
            while (matcher.find()) {
                String name = matcher.group(1);
                String value = values.get(name);
                if (value == null) {
                    throw new IllegalArgumentException("No value for {" + name + "} in \"" + text + "\"");
                }
                matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            matcher.appendTail(sb);
            args.add(sb.toString());
        }
        return args;
    }

    @Override
    public String toString() {
        return text;
    }
}
