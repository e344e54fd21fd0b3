package com.example.poscore.config.props;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Bearer token settings under {@code app.jwt}. */
@ConfigurationProperties(prefix = "app.jwt")
@Validated
public class JwtProperties {
    // base64, or plain text of at least 32 bytes
    @NotBlank
    private String secret;
    // milliseconds
    @Positive
    private long expiration = 86_400_000L;
    @NotBlank
    private String issuer = "pos-core";

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public long getExpiration() {
        return expiration;
    }

    public void setExpiration(long expiration) {
        this.expiration = expiration;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }
}
