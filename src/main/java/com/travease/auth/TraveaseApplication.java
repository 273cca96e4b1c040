package com.travease.auth;

import com.travease.auth.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
@EnableConfigurationProperties(AuthProperties.class)
public class TraveaseApplication {

	private static final Logger logger = LoggerFactory.getLogger(TraveaseApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(TraveaseApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Travease auth API listening on port {}", event.getWebServer().getPort());
	}

}
