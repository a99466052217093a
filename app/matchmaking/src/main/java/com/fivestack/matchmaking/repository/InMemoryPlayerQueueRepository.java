package com.fivestack.matchmaking.repository;

import com.fivestack.matchmaking.model.QueuedPlayer;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPlayerQueueRepository implements PlayerQueueRepository {

  // guards the waiting map and the id sequence; reentrant so exclusively() may nest calls
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, QueuedPlayer> waiting = new LinkedHashMap<>();
  private long lastPlayerId;

  @Override
  public QueuedPlayer insert(int rating, int form, double joinTime) {
    lock.lock();
    try {
      final QueuedPlayer player = new QueuedPlayer(++lastPlayerId, rating, form, joinTime);
      waiting.put(player.playerId(), player);
      return player;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int remove(Collection<QueuedPlayer> players) {
    lock.lock();
    try {
      int removed = 0;
      for (QueuedPlayer player : players) {
        if (waiting.remove(player.playerId()) != null) {
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return waiting.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<QueuedPlayer> snapshot() {
    lock.lock();
    try {
      return List.copyOf(waiting.values());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<Double> oldestJoinTime() {
    lock.lock();
    try {
      return waiting.values().stream().map(QueuedPlayer::joinTime).min(Double::compare);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> T exclusively(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
