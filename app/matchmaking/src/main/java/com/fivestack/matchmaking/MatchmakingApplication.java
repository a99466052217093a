/*
 * どこで: Matchmaking アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: Queue Store/Match Selector/メトリクスを単一アプリとして組み立てるため
 */
package com.fivestack.matchmaking;

import com.fivestack.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class MatchmakingApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchmakingApplication.class, args);
  }
}
