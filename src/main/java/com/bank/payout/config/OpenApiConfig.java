package com.bank.payout.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI payoutAutomationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Payout Automation API")
                        .version("1.0.0")
                        .description(
                                "Risk-scored merchant payout automation.\n\n" +
                                "**Admission Pipeline:**\n" +
                                "1. Submit a candidate via `POST /payouts`\n" +
                                "2. Snapshot the merchant risk score (0-100, five sub-factors)\n" +
                                "3. Decide **AUTO_APPROVE**, **MANUAL_REVIEW** or **AUTO_REJECT** (compliance only)\n" +
                                "4. Reserve daily/weekly/monthly limits for auto-approved payouts\n" +
                                "5. Queue workers execute approved payouts through the treasury, one per merchant at a time\n\n" +
                                "**Automation Levels:**\n" +
                                "- `FULL` (score >= 75): auto-approve within limits\n" +
                                "- `PARTIAL` (score >= 50): auto-approve small payouts only\n" +
                                "- `MANUAL_REVIEW`: every payout needs an operator\n\n" +
                                "All mutating endpoints require the `X-Operator-Id` header.")
                        .contact(new Contact().name("Treasury Automation Team")));
    }
}
