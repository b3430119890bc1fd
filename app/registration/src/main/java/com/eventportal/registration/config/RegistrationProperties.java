/*
 * どこで: Registration アプリの設定バインド
 * 何を: 競合時の再試行回数とロック待ち上限を保持する
 * なぜ: 同時登録が集中した際の振る舞いを運用で調整できるようにするため
 */
package com.eventportal.registration.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "registration")
public record RegistrationProperties(
    @Min(0) int conflictRetries,
    @NotNull Duration lockTimeout) {}
