/*
 * どこで: Matchmaking 設定
 * 何を: マッチ成立条件の設定不備を表現する
 * なぜ: どのマッチも成立し得ない設定を構築時点で拒否するため
 */
package com.fivestack.matchmaking.config;

public class InvalidMatchmakingConfigurationException extends RuntimeException {
  public InvalidMatchmakingConfigurationException(String message) {
    super(message);
  }
}
