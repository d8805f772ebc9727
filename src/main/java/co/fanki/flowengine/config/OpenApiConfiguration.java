package co.fanki.flowengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Flow Engine.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Flow Engine API")
                        .description("""
                                Flow Engine - validation, routing, answer piping and layout
                                for branching questionnaires stored as node and edge arrays.

                                ## Flows
                                - `POST /api/flows/validate` - Errors and warnings before publishing
                                - `POST /api/flows/next` - The screen that follows an answer
                                - `POST /api/flows/pipes/resolve` - Earlier answers piped into text
                                - `POST /api/flows/branch` - Nodes and edges around a selected node
                                - `POST /api/flows/ancestors` - Questions whose answers a screen may pipe
                                - `POST /api/flows/score` - Score and maximum score of a submission
                                - `POST /api/flows/outline` - A flow built from a question outline

                                ## Layout
                                - `POST /api/layout/full` - Layered auto-arrange
                                - `POST /api/layout/tidy` - Overlap cleanup that keeps the arrangement
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
