package com.kgbio.lookup.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("KG Bio Lookup API")
                        .version("0.1.0")
                        .description("Resolves an entity and a property named in free text, finds who held that "
                                + "property in a given year and returns the person's aggregated biography."))
                .addTagsItem(new Tag().name("lookup").description("Statement lookup and biography fetch"));
    }
}
