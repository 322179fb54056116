package com.chatflow.presence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class ChatFlowPresenceApplication {

    public static void main(String[] args) {
        log.info("Starting ChatFlow Presence Server...");
        SpringApplication.run(ChatFlowPresenceApplication.class, args);
        log.info("ChatFlow Presence Server started");
    }
}
