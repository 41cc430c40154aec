package com.chatbridge.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chatbridge")
public class ChatBridgeApp {

    private static final Logger log = LoggerFactory.getLogger(ChatBridgeApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(ChatBridgeApp.class, args);
        ctx.registerShutdownHook();
        var role = ctx.getEnvironment().getProperty("chatbridge.role", "engine");
        log.info("ChatBridge started role={}", role);
    }
}
