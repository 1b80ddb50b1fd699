package com.goormthonuniv.sentinel.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    public static final String TAG_ANALYSIS = "Analysis";
    public static final String TAG_MONITORING = "Monitoring";

    @Bean
    public OpenAPI sentinelOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sentinel Crisis Intelligence API")
                        .description("자율 감시 루프가 추적 중인 위기/루머 현황과 사용자 제보 검증 API")
                        .version("v0.1.0")
                        .contact(new Contact().name("Sentinel").email("ops@sentinel.local")))
                .tags(List.of(
                        new Tag().name(TAG_ANALYSIS).description("사용자 제보 검증(비동기)"),
                        new Tag().name(TAG_MONITORING).description("위기 목록, 타임라인, 알림")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
