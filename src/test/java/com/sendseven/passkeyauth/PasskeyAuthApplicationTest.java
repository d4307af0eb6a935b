package com.sendseven.passkeyauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Boots the application against the shipped application.yml, with provider settings
 * coming only from the environment.
 */
class PasskeyAuthApplicationTest {

    private static SpringApplicationBuilder application() {
        return new SpringApplicationBuilder(PasskeyAuthApplication.class)
                .web(WebApplicationType.NONE);
    }

    @Test
    void startup_withoutProviderEnvironment_fails() {
        assumeTrue(System.getenv("BI_TENANT_ID") == null, "BI_TENANT_ID is set in this environment");

        assertThatThrownBy(() -> application().run().close())
                .hasStackTraceContaining("beyond-identity")
                .hasStackTraceContaining("tenantId");
    }

    @Test
    void startup_withProviderEnvironment_resolvesEndpoints() {
        try (ConfigurableApplicationContext context = application().run(
                "--BI_TENANT_ID=tenant-9",
                "--BI_REALM_ID=realm-9",
                "--BI_APPLICATION_ID=app-9",
                "--BI_CLIENT_ID=client-9",
                "--BI_CLIENT_SECRET=secret-9",
                "--APP_REDIRECT_URI=http://localhost:8080/auth/callback")) {

            IdentityProviderProperties properties = context.getBean(IdentityProviderProperties.class);

            assertThat(properties.getTenantId()).isEqualTo("tenant-9");
            assertThat(properties.getAuthorizationEndpoint())
                    .doesNotContain("${")
                    .endsWith("/v1/tenants/tenant-9/realms/realm-9/applications/app-9/authorize");
        }
    }
}
