package com.marquee.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MarqueeApplication {
	public static void main(String[] args) {
		SpringApplication.run(MarqueeApplication.class, args);
	}
}
