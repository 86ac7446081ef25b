package com.assetsync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and the HTTP client for the Lansweeper GraphQL API.
 *
 * <p>Binds to the {@code lansweeper.*} prefix. Site id and personal access token usually come
 * from the {@code LANSWEEPER_SITE_ID} and {@code LANSWEEPER_PAT_TOKEN} environment variables.
 * Their presence is checked by the runner before any row is read, so the application context
 * still starts without them.
 */
@Configuration
@ConfigurationProperties(prefix = "lansweeper")
@Validated
@Getter
@Setter
public class LansweeperConfig {

    private static final Logger log = LoggerFactory.getLogger(LansweeperConfig.class);

    /** Lansweeper site id. */
    private String siteId;

    /** Personal access token, sent as {@code Authorization: Token <token>}. */
    private String token;

    @NotBlank
    private String apiUrl = "https://api.lansweeper.com/api/v2/graphql";

    /** HTTP connect timeout in milliseconds. */
    @Min(1)
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds. */
    @Min(1)
    private int readTimeout = 30000;

    @Bean
    public RestClient lansweeperRestClient() {
        log.info("Creating Lansweeper client for {} with token {}", apiUrl, maskToken(token));
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(apiUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + token)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private String maskToken(String value) {
        if (value == null || value.length() < 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
