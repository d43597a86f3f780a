package com.miniomcp.controller;

import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.tools.AiToolExecutor;
import com.miniomcp.tools.ToolRegistry;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry registry;
    private final AiToolExecutor executor;

    @Operation(summary = "列出全部存储工具（OpenAI function 声明格式）")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, Object>> list() {
        return registry.openAiToolsSchema();
    }

    /**
     * 直接调用一个工具，请求体即参数对象（可省略）。
     * 存储层错误以 status=ERROR 的结果返回，未知工具返回 404。
     */
    @Operation(summary = "调用存储工具")
    @PostMapping(
            value = "/{name}",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ToolResult> invoke(@PathVariable("name") String name,
                                   @RequestBody(required = false) Map<String, Object> args) {
        if (registry.get(name).isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown tool: " + name));
        }
        String callId = "http-" + UUID.randomUUID();
        log.debug("[{}] invoked over HTTP, callId={}", name, callId);
        // 工具内部会 block，放到弹性线程池
        return Mono.fromCallable(() -> executor.execute(name, args).withCallId(callId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
