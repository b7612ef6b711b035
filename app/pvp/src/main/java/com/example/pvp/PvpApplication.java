/*
 * どこで: PVP アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: マッチメイク API・試合ライフサイクル・ランキングを単一アプリとして起動するため
 */
package com.example.pvp;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class PvpApplication {

  public static void main(String[] args) {
    SpringApplication.run(PvpApplication.class, args);
  }
}
