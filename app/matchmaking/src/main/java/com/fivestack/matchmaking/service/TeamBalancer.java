/*
 * どこで: Matchmaking サービス層
 * 何を: 10 人を form の合計差が小さくなるよう 5 対 5 に分割する
 * なぜ: 候補ごとの balance score を決定的に求めるため
 */
package com.fivestack.matchmaking.service;

import com.fivestack.matchmaking.model.BalancedTeams;
import com.fivestack.matchmaking.model.MatchCandidate;
import com.fivestack.matchmaking.model.QueuedPlayer;
import com.fivestack.matchmaking.model.Team;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class TeamBalancer {

  static final Comparator<QueuedPlayer> FORM_DESCENDING =
      Comparator.comparingInt(QueuedPlayer::form)
          .reversed()
          .thenComparingLong(QueuedPlayer::playerId);

  /**
   * 役割: 貪欲法で 2 チームへ振り分ける。
   * 動作: form 降順(同値は playerId 昇順)に走査し、A が満員でなく、かつ B が満員か A の合計が B 以下なら A、それ以外は B に入れる。
   * 前提: players はちょうど 10 人。最適解は保証しない。
   */
  public BalancedTeams balance(List<QueuedPlayer> players) {
    if (players.size() != MatchCandidate.SIZE) {
      throw new IllegalArgumentException(
          "expected " + MatchCandidate.SIZE + " players: " + players.size());
    }
    final List<QueuedPlayer> ordered = new ArrayList<>(players);
    ordered.sort(FORM_DESCENDING);

    final List<QueuedPlayer> teamA = new ArrayList<>(Team.SIZE);
    final List<QueuedPlayer> teamB = new ArrayList<>(Team.SIZE);
    int sumA = 0;
    int sumB = 0;
    for (QueuedPlayer player : ordered) {
      final boolean teamAOpen = teamA.size() < Team.SIZE;
      final boolean teamBFull = teamB.size() >= Team.SIZE;
      if (teamAOpen && (teamBFull || sumA <= sumB)) {
        teamA.add(player);
        sumA += player.form();
      } else {
        teamB.add(player);
        sumB += player.form();
      }
    }
    return new BalancedTeams(new Team(teamA), new Team(teamB));
  }
}
