/*
 * どこで: Matchmaking Repository 層
 * 何を: 待機プレイヤー集合(Queue Store)の操作を抽象化する
 * なぜ: 保持方式の詳細を service から切り離すため
 */
package com.fivestack.matchmaking.repository;

import com.fivestack.matchmaking.model.QueuedPlayer;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public interface PlayerQueueRepository {

  /**
   * 役割: 新しいプレイヤーをキューへ追加する。 動作: 未使用の playerId を採番して末尾へ追加し、作成した record を返す。 前提: なし(常に成功する)。
   */
  QueuedPlayer insert(int rating, int form, double joinTime);

  /**
   * 役割: 指定プレイヤーをキューから削除する。 動作: playerId で一致したものだけを削除し、存在しないものは無視する。削除件数を返す。 前提: players は
   * null でないこと。
   */
  int remove(Collection<QueuedPlayer> players);

  /** 役割: 待機人数を返す。 */
  int size();

  /** 役割: 検索用に待機プレイヤーの不変コピーを返す。 動作: 追加順で返すが、順序に意味はない。 */
  List<QueuedPlayer> snapshot();

  /** 役割: 最も古い joinTime を返す。 動作: 空キューなら empty を返す。 */
  Optional<Double> oldestJoinTime();

  /**
   * 役割: 複数操作を 1 つのクリティカルセクションとして実行する。
   * 動作: insert/remove と同じロックを保持したまま action を実行する。action 内から本インターフェースの他メソッドを呼んでよい。
   * 前提: action はブロッキング I/O を行わないこと。
   */
  <T> T exclusively(Supplier<T> action);
}
