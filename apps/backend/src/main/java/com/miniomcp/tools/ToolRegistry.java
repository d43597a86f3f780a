package com.miniomcp.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

@Component
@Slf4j
public class ToolRegistry {
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    // 只在构造期写，之后只读：线程安全
    private final Map<String, AiTool> tools = new LinkedHashMap<>();
    private final Map<String, AiTool> lookup = new HashMap<>();

    private final List<Map<String, Object>> openAiToolsSchemaCached;

    public ToolRegistry(List<AiTool> toolBeans) {
        log.debug("Initializing ToolRegistry with {} tool bean(s)", toolBeans.size());

        Set<String> seenLower = new HashSet<>();
        for (AiTool tool : toolBeans) {
            String name = Objects.requireNonNull(tool.name(), "tool.name() must not be null").trim();

            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid tool name: '" + name + "'. " +
                        "Expected pattern " + NAME_PATTERN.pattern());
            }
            String lower = name.toLowerCase(Locale.ROOT);
            if (!seenLower.add(lower)) {
                // 禁止仅大小写不同的重名，避免 lookup 覆盖
                throw new IllegalStateException("Duplicate tool name (case-insensitive): '" + name + "'");
            }

            Map<String, Object> schema = Objects.requireNonNull(
                    tool.parametersSchema(), () -> "parametersSchema() is null for tool " + name);
            Object type = schema.get("type");
            if (!"object".equals(String.valueOf(type))) {
                throw new IllegalStateException("Tool '" + name +
                        "' parametersSchema().type must be 'object', got: " + type);
            }

            tools.put(name, tool);
            lookup.put(name, tool);
            lookup.put(lower, tool);
            log.debug("Registered tool '{}' ({})", name, tool.getClass().getSimpleName());
        }

        this.openAiToolsSchemaCached = Collections.unmodifiableList(tools.values().stream()
                .map(ToolRegistry::toOpenAiFunctionMap)
                .toList());
        log.info("Registered {} storage tool(s): {}", tools.size(), tools.keySet());
    }

    public Optional<AiTool> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        AiTool tool = lookup.get(name);
        if (tool == null) {
            tool = lookup.get(name.toLowerCase(Locale.ROOT));
        }
        if (tool == null) {
            log.debug("Tool '{}' not found in registry", name);
        }
        return Optional.ofNullable(tool);
    }

    /** OpenAI 风格的 function 声明：{ "type":"function", "function":{ name, description, parameters } } */
    public List<Map<String, Object>> openAiToolsSchema() {
        return openAiToolsSchemaCached;
    }

    public List<AiTool> allTools() {
        return List.copyOf(tools.values());
    }

    private static Map<String, Object> toOpenAiFunctionMap(AiTool tool) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", tool.name());
        function.put("description", tool.description());
        function.put("parameters", tool.parametersSchema());
        Map<String, Object> wrapper = new LinkedHashMap<>();
        wrapper.put("type", "function");
        wrapper.put("function", function);
        return wrapper;
    }
}
