/*
 * どこで: Matchmaking ドメインモデル
 * 何を: Match Selector が選んだ 10 人と分割結果を表現する
 * なぜ: 選択と削除を同一スナップショットに対して行うため、選ばれた集合を確定値で渡す
 */
package com.fivestack.matchmaking.model;

import java.util.List;

public record MatchCandidate(List<QueuedPlayer> players, BalancedTeams teams, int ratingSpan) {

  public static final int SIZE = Team.SIZE * 2;

  public MatchCandidate {
    players = List.copyOf(players);
    if (players.size() != SIZE) {
      throw new IllegalArgumentException(
          "match candidate must have " + SIZE + " players: " + players.size());
    }
  }
}
