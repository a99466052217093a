/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 10 人を 2 チームへ分割した結果を表現する
 * なぜ: 候補比較に使う balance score を分割結果から一意に導くため
 */
package com.fivestack.matchmaking.model;

public record BalancedTeams(Team teamA, Team teamB) {

  /** teamA と teamB の form 合計差の絶対値。両チーム同人数なので balance score と同順序になる。 */
  public int formSumDifference() {
    return Math.abs(teamA.formSum() - teamB.formSum());
  }

  /** 両チームの平均 form の差の絶対値。小さいほど均衡している。 */
  public double balanceScore() {
    return Math.abs(teamA.averageForm() - teamB.averageForm());
  }
}
