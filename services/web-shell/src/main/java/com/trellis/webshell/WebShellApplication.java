package com.trellis.webshell;

import com.trellis.webshell.config.WebShellProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Trellis web shell: a server-rendered application whose pages load either whole or as fragments
 * for the htmx client.
 *
 * <p>Key pieces configured by default:
 *
 * <ul>
 *   <li>Thymeleaf-backed template catalog, verified at startup
 *   <li>Request log context (request, session, user and tenant ids in every log line)
 *   <li>Notification flash across redirects
 *   <li>Actuator health, metrics and Prometheus endpoints
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(WebShellProperties.class)
public class WebShellApplication {

    private static final Logger log = LoggerFactory.getLogger(WebShellApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WebShellApplication.class, args);
        log.info("Trellis web shell started successfully");
    }
}
