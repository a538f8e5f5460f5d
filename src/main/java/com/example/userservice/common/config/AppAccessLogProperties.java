package com.example.userservice.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.access-log")
public class AppAccessLogProperties {

    private boolean enabled = true;

    /**
     * Header carrying the caller's request id; generated when absent and echoed on the response.
     */
    private String requestIdHeader = "X-Request-Id";
}
