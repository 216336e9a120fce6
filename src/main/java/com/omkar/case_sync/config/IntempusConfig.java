package com.omkar.case_sync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the Intempus case API.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "intempus")
public class IntempusConfig {
    private String apiUri = "https://intempus.dk/web/v1";
    private String apiUser;
    private String apiKey;
    private Duration timeout = Duration.ofSeconds(30);
    private int pageLimit = 1000;

    public String getCaseUri() {
        return apiUri + "/case/";
    }

    public String getAuthorization() {
        return "apikey " + apiUser + ":" + apiKey;
    }
}
