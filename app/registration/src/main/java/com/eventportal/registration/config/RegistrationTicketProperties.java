/*
 * どこで: Registration アプリの設定バインド
 * 何を: チケット署名の発行者名と鍵を保持する
 * なぜ: HMAC-SHA256 に必要な鍵長を起動時に検証するため
 */
package com.eventportal.registration.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "registration.ticket")
public record RegistrationTicketProperties(
    @NotBlank String issuer,
    @NotBlank @Size(min = 32, message = "secret must be at least 32 characters") String secret) {}
