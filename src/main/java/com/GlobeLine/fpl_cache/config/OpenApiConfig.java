package com.GlobeLine.fpl_cache.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;

@Configuration
public class OpenApiConfig {

	@Bean
	public OpenAPI fplCacheOpenAPI() {
		return new OpenAPI()
				.info(new Info()
						.title("FPL Cache API")
						.description("Fantasy Premier League data served through a read-through disk cache. " +
								"Responses carry their origin (cache, revalidated, upstream) and a stale flag " +
								"when an expired entry was served because the FPL API could not be reached.")
						.version("1.0.0")
						.contact(new Contact()
								.name("FPL Cache maintainers")
								.url("https://fantasy.premierleague.com/api/"))
						.license(new License()
								.name("FPL data remains subject to the Fantasy Premier League terms of use")));
	}
}
