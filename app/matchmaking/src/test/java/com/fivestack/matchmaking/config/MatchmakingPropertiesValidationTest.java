/*
 * どこで: Matchmaking 設定のバリデーションテスト
 * 何を: MatchmakingProperties の Bean Validation を検証する
 * なぜ: 起動時に不正な rating 幅を検出できるようにするため
 */
package com.fivestack.matchmaking.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatchmakingPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesForZeroAndPositiveDistance() {
    assertThat(validator.validate(new MatchmakingProperties(0))).isEmpty();
    assertThat(validator.validate(new MatchmakingProperties(200))).isEmpty();
  }

  @Test
  void validationFailsWhenDistanceIsNegative() {
    assertThat(validator.validate(new MatchmakingProperties(-1))).isNotEmpty();
  }

  @Test
  void validationFailsWhenDistanceIsMissing() {
    assertThat(validator.validate(new MatchmakingProperties(null))).isNotEmpty();
  }
}
