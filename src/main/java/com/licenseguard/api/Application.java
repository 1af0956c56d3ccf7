package com.licenseguard.api;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.licenseguard.api.identity.LeaseTokenAuthFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.firewall.HttpStatusRequestRejectedHandler;
import org.springframework.security.web.firewall.RequestRejectedHandler;
import org.springframework.stereotype.Component;

// exclude user details service from Spring security. Devices authenticate with lease tokens only.
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
@EnableCaching
@EnableScheduling
@ConfigurationPropertiesScan(basePackageClasses = Application.class)
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        return builder -> {
            builder.featuresToEnable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            builder.featuresToDisable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS);
        };
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull BuildProperties buildProperties) {
        return new OpenAPI()
            .info(
                new Info()
                    .title("Licensing API")
                    .version(String.format("v%s", buildProperties.getVersion())))
            .components(
                new Components()
                    .addSecuritySchemes("lease-token", new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT"))
                    .addSecuritySchemes("device-id", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name(LeaseTokenAuthFilter.DEVICE_ID_HEADER)))
            .addSecurityItem(new SecurityRequirement().addList("lease-token").addList("device-id"));
    }

    @NonNull
    @Bean
    HttpExchangeRepository httpExchangeRepository() {
        return new InMemoryHttpExchangeRepository();
    }

    @Bean
    SecurityFilterChain securityFilterChain(
        @NonNull HttpSecurity http,
        @NonNull LeaseTokenAuthFilter leaseTokenAuthFilter
    ) throws Exception {
        // disable default filters.
        http.cors().disable()
            .csrf().disable()
            .formLogin().disable()
            .headers().disable()
            .httpBasic().disable()
            .jee().disable()
            .logout().disable()
            .rememberMe().disable()
            .requestCache().disable()
            .securityContext().disable()
            .sessionManagement().disable();

        // Always return 401. Clients recover by registering the device again, which hands out a
        // new lease.
        http.exceptionHandling().authenticationEntryPoint(
            (request, response, authException) -> response.setStatus(HttpServletResponse.SC_UNAUTHORIZED));

        http.authorizeHttpRequests()
            .requestMatchers(HttpMethod.POST, "/v1/auth/register").permitAll()
            .requestMatchers(HttpMethod.POST, "/v1/subscriptions/stripe/webhook").permitAll()
            .requestMatchers("/v?*/**").fullyAuthenticated()
            .anyRequest().permitAll();

        // set SecurityContext based on the lease token and the device id header.
        http.addFilterBefore(leaseTokenAuthFilter, AnonymousAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    RequestRejectedHandler requestRejectedHandler() {
        return new HttpStatusRequestRejectedHandler();
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private BuildProperties buildProperties;

        @Override
        public void run(ApplicationArguments args) {
            log.info("Running {} version: v{}", buildProperties.getName(), buildProperties.getVersion());
        }
    }
}
