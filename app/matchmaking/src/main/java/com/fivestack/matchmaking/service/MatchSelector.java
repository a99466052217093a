package com.fivestack.matchmaking.service;

import com.fivestack.matchmaking.config.InvalidMatchmakingConfigurationException;
import com.fivestack.matchmaking.config.MatchmakingProperties;
import com.fivestack.matchmaking.model.BalancedTeams;
import com.fivestack.matchmaking.model.MatchCandidate;
import com.fivestack.matchmaking.model.QueuedPlayer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Picks the best group of ten from a queue snapshot.
 *
 * <p>Players are sorted by rating, then id. Every start index yields at most one window: the
 * consecutive players whose rating stays within {@code maxRatingDistance} of the window's first
 * member, capped at ten. Full windows are balanced and the one with the smallest form gap wins;
 * on equal gaps the lowest start index is kept.
 *
 * <p>Each window is balanced separately, so a search costs O(n^2 log n) in the queue size. That
 * is fine while the live queue stays small.
 */
@Component
public class MatchSelector {

  static final Comparator<QueuedPlayer> RATING_ASCENDING =
      Comparator.comparingInt(QueuedPlayer::rating).thenComparingLong(QueuedPlayer::playerId);

  private final int maxRatingDistance;
  private final TeamBalancer teamBalancer;

  public MatchSelector(MatchmakingProperties properties, TeamBalancer teamBalancer) {
    if (properties == null || properties.maxRatingDistance() == null) {
      throw new InvalidMatchmakingConfigurationException("maxRatingDistance is required");
    }
    if (properties.maxRatingDistance() < 0) {
      throw new InvalidMatchmakingConfigurationException(
          "maxRatingDistance must not be negative: " + properties.maxRatingDistance());
    }
    this.maxRatingDistance = properties.maxRatingDistance();
    this.teamBalancer = teamBalancer;
  }

  public Optional<MatchCandidate> select(List<QueuedPlayer> waiting) {
    if (waiting.size() < MatchCandidate.SIZE) {
      return Optional.empty();
    }
    final List<QueuedPlayer> sorted = new ArrayList<>(waiting);
    sorted.sort(RATING_ASCENDING);

    MatchCandidate best = null;
    int bestDifference = Integer.MAX_VALUE;
    for (int start = 0; start <= sorted.size() - MatchCandidate.SIZE; start++) {
      final List<QueuedPlayer> window = windowFrom(sorted, start);
      if (window.size() < MatchCandidate.SIZE) {
        continue;
      }
      final int span = ratingSpan(window);
      if (span > maxRatingDistance) {
        continue;
      }
      final BalancedTeams teams = teamBalancer.balance(window);
      if (teams.formSumDifference() < bestDifference) {
        best = new MatchCandidate(window, teams, span);
        bestDifference = teams.formSumDifference();
      }
    }
    return Optional.ofNullable(best);
  }

  private List<QueuedPlayer> windowFrom(List<QueuedPlayer> sorted, int start) {
    final int lowest = sorted.get(start).rating();
    final List<QueuedPlayer> window = new ArrayList<>(MatchCandidate.SIZE);
    for (int i = start; i < sorted.size() && window.size() < MatchCandidate.SIZE; i++) {
      final QueuedPlayer player = sorted.get(i);
      // sorted by rating, so nothing further along can fit either
      if ((long) player.rating() - lowest > maxRatingDistance) {
        break;
      }
      window.add(player);
    }
    return window;
  }

  private static int ratingSpan(List<QueuedPlayer> players) {
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (QueuedPlayer player : players) {
      min = Math.min(min, player.rating());
      max = Math.max(max, player.rating());
    }
    return max - min;
  }
}
