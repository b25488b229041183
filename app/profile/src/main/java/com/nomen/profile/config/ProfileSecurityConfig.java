package com.nomen.profile.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(ProfileInternalApiProperties.class)
public class ProfileSecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      ProfileInternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, InternalApiAuthenticationFilter internalApiAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/internal/principals")
                    .hasRole("INTERNAL")
                    .requestMatchers(HttpMethod.POST, "/internal/identities:sync")
                    .hasRole("INTERNAL")
                    .requestMatchers("/me/**")
                    .hasRole("USER")
                    .requestMatchers(
                        HttpMethod.POST,
                        "/merge-requests:lookup",
                        "/merge-requests:cancel",
                        "/merge-requests:execute")
                    .hasRole("USER")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
