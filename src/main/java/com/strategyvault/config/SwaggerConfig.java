package com.strategyvault.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI vaultOpenAPI(VaultConfig vaultConfig) {
        return new OpenAPI()
                .info(buildApiInfo(vaultConfig))
                .servers(List.of(new Server().url("http://localhost:8080").description("Local Development Server")))
                .tags(buildApiTags());
    }

    private Info buildApiInfo(VaultConfig vaultConfig) {
        return new Info()
                .title(vaultConfig.getName() + " API")
                .description("""
                        Pooled-capital vault allocating one asset across several yield strategies.

                        Key Features:
                        • Share accounting with deposit, mint, withdraw and redeem
                        • Strategy registry with per-strategy and aggregate allocation caps
                        • Manager-triggered two-pass rebalancing
                        • Withdrawal queue for partial-liquidity conditions
                        • Pause switch and emergency unwind
                        • Simulation endpoints for local testing
                        """)
                .version("1.0.0")
                .license(new License()
                        .name("Apache 2.0")
                        .url("https://www.apache.org/licenses/LICENSE-2.0.html"));
    }

    private List<Tag> buildApiTags() {
        return List.of(
                new Tag().name("Vault").description("Deposits, withdrawals, queue and share accounting"),
                new Tag().name("Strategies").description("Strategy registry and rebalancing"),
                new Tag().name("Admin").description("Pause switch and emergency unwind"),
                new Tag().name("Simulation").description("In-process asset faucet and simulated strategies"),
                new Tag().name("Health").description("Application health checks")
        );
    }
}
