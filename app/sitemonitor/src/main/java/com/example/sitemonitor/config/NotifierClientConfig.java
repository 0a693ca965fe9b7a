/*
 * どこで: SiteMonitor 設定
 * 何を: Slack webhook observer 共通の RestClient を提供する
 * なぜ: webhook URL は notifier ごとに異なるが、タイムアウトとコンバータは共通のため
 */
package com.example.sitemonitor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(SlackNotifierProperties.class)
public class NotifierClientConfig {

  @Bean
  RestClient slackRestClient(RestClient.Builder builder, SlackNotifierProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
