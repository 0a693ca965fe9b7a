/*
 * どこで: SiteMonitor アプリのエントリポイント
 * 何を: Spring を起動し、設定プロパティを走査する
 * なぜ: スケジューラ・通知 hub・リポジトリを 1 プロセスに組み上げるため
 */
package com.example.sitemonitor;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class SiteMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteMonitorApplication.class, args);
  }
}
