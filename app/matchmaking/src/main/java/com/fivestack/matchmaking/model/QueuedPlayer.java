/*
 * どこで: Matchmaking ドメインモデル
 * 何を: キューで待機しているプレイヤーを表現する
 * なぜ: 同一 rating/form でも playerId が異なれば別人として扱うため
 */
package com.fivestack.matchmaking.model;

/**
 * 役割: 待機中プレイヤーの不変スナップショット。
 * 動作: 等価性と hashCode は playerId のみで判定する。
 * 前提: playerId は Queue Store が採番し、再利用されない。
 */
public record QueuedPlayer(long playerId, int rating, int form, double joinTime) {

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof QueuedPlayer player && playerId == player.playerId;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(playerId);
  }
}
