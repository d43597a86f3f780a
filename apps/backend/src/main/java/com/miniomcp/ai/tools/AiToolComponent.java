package com.miniomcp.ai.tools;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;
import java.lang.annotation.*;

/**
 * 标记一个 {@link com.miniomcp.tools.AiTool} 实现，注册为 Spring Bean 后由 ToolRegistry 收集。
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface AiToolComponent {
    @AliasFor(annotation = Component.class)
    String value() default "";
}
