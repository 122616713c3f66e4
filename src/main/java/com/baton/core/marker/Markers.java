package com.baton.core.marker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and renders the structured blocks that make up the coordination wire format.
 * <p>
 * A block is delimited by HTML comments so it stays invisible in rendered issue threads:
 * <pre>
 * &lt;!-- baton:scope --&gt;
 * claimed:
 * - src/auth/Login.java
 * excluded: docs/
 * &lt;!-- /baton:scope --&gt;
 * </pre>
 * Unknown block types are ignored. Text outside blocks is never interpreted.
 */
public final class Markers {

    private static final Pattern BLOCK_PATTERN = Pattern.compile(
            "<!--\\s*baton:([a-z-]+)\\s*-->(.*?)<!--\\s*/baton:\\1\\s*-->",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern FIELD_PATTERN = Pattern.compile("^([A-Za-z][A-Za-z _-]{0,31}):(.*)$");

    private static final Pattern ITEM_PATTERN = Pattern.compile("^[-*]\\s+(.*)$");

    private Markers() {}

    public static List<MarkerBlock> parse(String body) {
        if (body == null || body.isBlank()) return List.of();
        var blocks = new ArrayList<MarkerBlock>();
        Matcher matcher = BLOCK_PATTERN.matcher(body);
        while (matcher.find()) {
            MarkerType.fromTag(matcher.group(1))
                    .ifPresent(type -> blocks.add(new MarkerBlock(type, parseFields(matcher.group(2)))));
        }
        return blocks;
    }

    /** First block of the given type in the body. */
    public static Optional<MarkerBlock> find(String body, MarkerType type) {
        return parse(body).stream().filter(b -> b.type() == type).findFirst();
    }

    public static String render(MarkerBlock block) {
        var sb = new StringBuilder();
        sb.append("<!-- baton:").append(block.type().tag()).append(" -->\n");
        block.fields().forEach((key, values) -> {
            if (values.size() == 1) {
                sb.append(key).append(": ").append(values.get(0)).append('\n');
            } else {
                sb.append(key).append(":\n");
                for (String value : values) {
                    sb.append("- ").append(value).append('\n');
                }
            }
        });
        sb.append("<!-- /baton:").append(block.type().tag()).append(" -->");
        return sb.toString();
    }

    /** A human-readable line followed by the rendered block. */
    public static String render(String summary, MarkerBlock block) {
        return summary + "\n\n" + render(block);
    }

    private static Map<String, List<String>> parseFields(String content) {
        var fields = new LinkedHashMap<String, List<String>>();
        String currentKey = null;
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) continue;

            Matcher item = ITEM_PATTERN.matcher(line);
            if (item.matches() && currentKey != null) {
                fields.get(currentKey).add(item.group(1).trim());
                continue;
            }

            Matcher field = FIELD_PATTERN.matcher(line);
            if (field.matches()) {
                currentKey = MarkerBlock.normalizeKey(field.group(1));
                var values = fields.computeIfAbsent(currentKey, k -> new ArrayList<>());
                String inline = field.group(2).trim();
                if (!inline.isEmpty()) {
                    values.add(inline);
                }
                continue;
            }

            // Continuation of the previous field's free text
            if (currentKey != null) {
                fields.get(currentKey).add(line);
            }
        }
        return fields;
    }
}
