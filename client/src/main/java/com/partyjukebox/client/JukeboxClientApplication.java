/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JukeboxClientApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(JukeboxClientApplication.class);
        app.setRegisterShutdownHook(true); // ContextClosedEvent on JVM shutdown closes the connection
        app.run(args);
    }
}
