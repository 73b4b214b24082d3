package com.chatrelay.gateway;

import com.chatrelay.shared.config.ConfigLoader;
import com.chatrelay.shared.config.RelayConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.chatrelay")
public class ChatRelayApp {

    public static void main(String[] args) {
        var app = new SpringApplication(ChatRelayApp.class);
        app.setDefaultProperties(defaultProperties(ConfigLoader.load()));
        app.run(args);
    }

    /** The listener port comes from config.yaml unless overridden on the command line. */
    static Map<String, Object> defaultProperties(RelayConfig config) {
        return Map.of("server.port", config.serverPort());
    }
}
