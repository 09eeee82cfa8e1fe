package com.aigreentick.services.otprelay;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the OTP relay service.
 *
 * This service handles:
 * - Number allocation through the upstream getnum API (/range chat command)
 * - Persisting which Telegram chat owns each allocated number
 * - Receiving OTP callbacks on /callback and forwarding them to the owning chat
 * - Escalating unroutable callbacks to an optional admin chat
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "OTP Relay Service API",
                version = "1.0.0",
                description = "Relays OTP callbacks from the number allocation provider to Telegram chats."
        ),
        servers = {
                @Server(url = "http://localhost:5000", description = "Local Development")
        }
)
public class OtpRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OtpRelayApplication.class, args);
    }
}
