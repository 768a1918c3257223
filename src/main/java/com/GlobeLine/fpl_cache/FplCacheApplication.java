package com.GlobeLine.fpl_cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FplCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(FplCacheApplication.class, args);
	}
}
