/*
 * どこで: Matchmaking 設定
 * 何を: マッチ成立条件(許容 rating 幅)を保持する
 * なぜ: 環境差分をコード外へ出し、起動時に不正値を検出するため
 */
package com.fivestack.matchmaking.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "matchmaking")
@Validated
public record MatchmakingProperties(@NotNull @PositiveOrZero Integer maxRatingDistance) {}
