package com.ias.distributor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI distributorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("IAS Reward Distributor API")
                        .description(
                                "Epoch reward settlement - operator batch distribution, signed affiliate claims and ledger queries")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("IAS Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
