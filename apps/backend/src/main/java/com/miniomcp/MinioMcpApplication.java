package com.miniomcp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class MinioMcpApplication {

    public static void main(String[] args) {
        log.info("Starting MinIO MCP tool server");
        SpringApplication.run(MinioMcpApplication.class, args);
        log.info("MinIO MCP tool server started");
    }

}
