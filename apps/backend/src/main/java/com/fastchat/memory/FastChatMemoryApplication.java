package com.fastchat.memory;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan(basePackages = "com.fastchat.memory.mapper")
@Slf4j
public class FastChatMemoryApplication {

    public static void main(String[] args) {
        log.info("Starting fast-chat memory service");
        SpringApplication.run(FastChatMemoryApplication.class, args);
        log.info("fast-chat memory service started");
    }
}
