package com.compliance.guardian.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI emailGuardianOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Email Guardian API")
                        .version("1.0.0")
                        .description(
                                "Email risk classification, admin rules and investigation case workflow.\n\n" +
                                "**Import Pipeline:**\n" +
                                "1. Submit rows via `POST /api/v1/imports`\n" +
                                "2. Rows are normalized; bad rows are skipped with a reason\n" +
                                "3. Each email is scored by the naive Bayes classifier (0-1) and categorized\n" +
                                "4. Admin rules run in priority order and may flag, re-categorize or escalate\n" +
                                "5. Escalated emails (rule directive or score >= 0.7) get an **OPEN** case\n\n" +
                                "**Case Lifecycle:**\n" +
                                "- `OPEN` -> `UNDER_REVIEW` | `ESCALATED` | `FALSE_POSITIVE`\n" +
                                "- `UNDER_REVIEW` -> `ESCALATED` | `CLOSED` | `FALSE_POSITIVE`\n" +
                                "- `ESCALATED` -> `CLOSED`\n\n" +
                                "Status changes require the `expectedVersion` last read; stale versions return **409**.")
                        .contact(new Contact().name("Compliance Engineering")));
    }
}
