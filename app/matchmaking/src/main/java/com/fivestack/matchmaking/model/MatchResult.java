/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 1 回のマッチ成立結果を表現する
 * なぜ: 呼び出し側へ 2 チームと報告用の付随情報をまとめて返すため
 */
package com.fivestack.matchmaking.model;

import java.time.Instant;

/**
 * 役割: 成立済みマッチ。
 * 動作: formedAt は成立時点の currentTime(呼び出し側の時刻単位)、matchedAt は壁時計時刻。
 * 前提: teamA と teamB は重複しない 5 人ずつで、既にキューから削除済み。
 */
public record MatchResult(
    String matchId,
    long matchNumber,
    Team teamA,
    Team teamB,
    int ratingSpan,
    double balanceScore,
    double formedAt,
    Instant matchedAt) {

  public double waitTimeOf(QueuedPlayer player) {
    if (!teamA.contains(player) && !teamB.contains(player)) {
      throw new IllegalArgumentException("player not in match: " + player.playerId());
    }
    return formedAt - player.joinTime();
  }
}
