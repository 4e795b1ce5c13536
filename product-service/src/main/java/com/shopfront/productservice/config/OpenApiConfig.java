package com.shopfront.productservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document served at /v3/api-docs, browsable at /swagger-ui.html
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(apiServers());
    }

    private Info apiInfo() {
        return new Info()
                .title("Products API")
                .description("Get details for all the products on the catalog, register sellers and log in.")
                .version("1.0.0")
                .termsOfService("https://www.wisecrackr.com/terms")
                .contact(new Contact()
                        .name("Patrick Yip")
                        .url("https://www.wisecrackr.com")
                        .email("support@wisecrackr.com"));
    }

    private List<Server> apiServers() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        return List.of(localServer);
    }
}
