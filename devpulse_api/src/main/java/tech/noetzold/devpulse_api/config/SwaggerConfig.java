package tech.noetzold.devpulse_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("DevPulse Insights API")
                        .version("1.0.0")
                        .description("Defect triage scoring and team capacity/burnout dashboards")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8085")
                                .description("Development server")))
                .tags(List.of(
                        new Tag().name("Dashboard").description("Team capacity and burnout risk"),
                        new Tag().name("Triage").description("Defect priority and impact scoring")));
    }
}
