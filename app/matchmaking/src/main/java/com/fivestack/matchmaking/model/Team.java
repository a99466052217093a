/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 5 人で構成される片側チームを表現する
 * なぜ: チームごとの form 合計/平均を結果とともに保持するため
 */
package com.fivestack.matchmaking.model;

import java.util.List;

public record Team(List<QueuedPlayer> players) {

  public static final int SIZE = 5;

  public Team {
    players = List.copyOf(players);
    if (players.size() != SIZE) {
      throw new IllegalArgumentException("team must have " + SIZE + " players: " + players.size());
    }
  }

  public int formSum() {
    int sum = 0;
    for (QueuedPlayer player : players) {
      sum += player.form();
    }
    return sum;
  }

  public double averageForm() {
    return (double) formSum() / SIZE;
  }

  public boolean contains(QueuedPlayer player) {
    return players.contains(player);
  }
}
