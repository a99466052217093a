package com.fivestack.matchmaking.service;

import com.fivestack.matchmaking.model.MatchCandidate;
import com.fivestack.matchmaking.model.MatchResult;
import com.fivestack.matchmaking.model.MatchmakingSummary;
import com.fivestack.matchmaking.model.QueuedPlayer;
import com.fivestack.matchmaking.model.Team;
import com.fivestack.matchmaking.repository.PlayerQueueRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class MatchmakingService {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingService.class);
  private static final String MDC_MATCH_ID = "match_id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "PlayerQueueRepository は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final PlayerQueueRepository queueRepository;

  private final MatchSelector matchSelector;
  private final MatchmakingMetrics metrics;
  private final Clock clock;
  private final AtomicLong matchCount = new AtomicLong();

  // written only while holding the queue lock
  private volatile double currentTime;

  public MatchmakingService(
      PlayerQueueRepository queueRepository,
      MatchSelector matchSelector,
      MatchmakingMetrics metrics,
      Clock clock) {
    this.queueRepository = queueRepository;
    this.matchSelector = matchSelector;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: プレイヤーをキューへ追加する。
   * 動作: playerId を採番して追加し、currentTime を joinTime まで進める(巻き戻さない)。
   * 前提: なし(常に成功する)。
   */
  public QueuedPlayer insert(int rating, int form, double joinTime) {
    final QueuedPlayer player =
        queueRepository.exclusively(
            () -> {
              final QueuedPlayer inserted = queueRepository.insert(rating, form, joinTime);
              currentTime = Math.max(currentTime, joinTime);
              updateQueueGauges();
              return inserted;
            });
    logger.debug(
        "player joined playerId={} rating={} form={} joinTime={}",
        player.playerId(),
        player.rating(),
        player.form(),
        player.joinTime());
    return player;
  }

  /**
   * 役割: 現在のキューから 1 マッチの成立を試みる。
   * 動作: スナップショット取得、選択、削除、カウンタ更新を 1 つのクリティカルセクションで行う。成立しなければ empty を返しキューは変化しない。
   * 前提: 削除件数が選択人数と一致しない場合は内部不整合として IllegalStateException を送出する。
   */
  public Optional<MatchResult> attemptMatch() {
    final Optional<MatchResult> result = queueRepository.exclusively(this::formMatch);
    if (result.isEmpty()) {
      metrics.recordMatchResult("no_match");
      return result;
    }
    report(result.get());
    return result;
  }

  public int queueSize() {
    return queueRepository.size();
  }

  public long matchCount() {
    return matchCount.get();
  }

  public double currentTime() {
    return currentTime;
  }

  public MatchmakingSummary summary() {
    return queueRepository.exclusively(
        () -> {
          final long matches = matchCount.get();
          return new MatchmakingSummary(
              matches, matches * MatchCandidate.SIZE, queueRepository.size(), currentTime);
        });
  }

  private Optional<MatchResult> formMatch() {
    final List<QueuedPlayer> waiting = queueRepository.snapshot();
    final Optional<MatchCandidate> selected = matchSelector.select(waiting);
    if (selected.isEmpty()) {
      logger.debug("no match formable queueSize={}", waiting.size());
      return Optional.empty();
    }
    final MatchCandidate candidate = selected.get();
    final int removed = queueRepository.remove(candidate.players());
    if (removed != candidate.players().size()) {
      metrics.recordInternalError("queue_removal_desync");
      logger.error(
          "selected players missing from queue selected={} removed={} playerIds={}",
          candidate.players().size(),
          removed,
          playerIds(candidate.players()));
      throw new IllegalStateException(
          "queue removal desync: selected "
              + candidate.players().size()
              + " players but removed "
              + removed);
    }
    final long matchNumber = matchCount.incrementAndGet();
    updateQueueGauges();
    return Optional.of(
        new MatchResult(
            "match-" + matchNumber,
            matchNumber,
            candidate.teams().teamA(),
            candidate.teams().teamB(),
            candidate.ratingSpan(),
            candidate.teams().balanceScore(),
            currentTime,
            Instant.now(clock)));
  }

  // caller holds the queue lock
  private void updateQueueGauges() {
    metrics.updateQueueDepth(queueRepository.size());
    final double oldest = queueRepository.oldestJoinTime().orElse(currentTime);
    metrics.updateOldestQueueAge(currentTime - oldest);
  }

  private void report(MatchResult match) {
    MDC.put(MDC_MATCH_ID, match.matchId());
    try {
      metrics.recordMatchResult("matched");
      metrics.recordMatchQuality(match.ratingSpan(), match.balanceScore());
      recordWaitTimes(match, match.teamA());
      recordWaitTimes(match, match.teamB());
      logger.info(
          "match formed matchNumber={} ratingSpan={} balanceScore={} teamA={} teamB={}",
          match.matchNumber(),
          match.ratingSpan(),
          match.balanceScore(),
          playerIds(match.teamA().players()),
          playerIds(match.teamB().players()));
    } finally {
      MDC.remove(MDC_MATCH_ID);
    }
  }

  private void recordWaitTimes(MatchResult match, Team team) {
    for (QueuedPlayer player : team.players()) {
      metrics.recordTimeToMatchSeconds(match.waitTimeOf(player));
    }
  }

  private static List<Long> playerIds(List<QueuedPlayer> players) {
    return players.stream().map(QueuedPlayer::playerId).toList();
  }
}
