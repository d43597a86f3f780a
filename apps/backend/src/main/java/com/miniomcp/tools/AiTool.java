package com.miniomcp.tools;

import com.miniomcp.api.dto.ToolResult;

import java.util.Map;

public interface AiTool {
    String name();

    String description();

    /** JSON Schema，顶层 type 必须是 object */
    Map<String, Object> parametersSchema();

    /**
     * Execute the tool with parsed arguments.
     * <p>
     * 返回的 data 约定：
     * <ol>
     *   <li>顶层放一段简短的 {@code text} 摘要（例如“列出 3 个存储桶”），记忆/提示词直接读取。</li>
     *   <li>其余结构化字段（buckets、objects、result 等）照常返回。</li>
     *   <li>存储层错误返回 {@link ToolResult#error}，同样带可读的 text/message。</li>
     * </ol>
     */
    ToolResult execute(Map<String, Object> args) throws Exception;
}
