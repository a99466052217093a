/*
 * どこで: Matchmaking ドメインモデル
 * 何を: キューとマッチ数の集計値を表現する
 * なぜ: 実行終了時のサマリ出力に必要な値を一度に取得するため
 */
package com.fivestack.matchmaking.model;

public record MatchmakingSummary(
    long matchCount, long playersMatched, int queueSize, double currentTime) {}
