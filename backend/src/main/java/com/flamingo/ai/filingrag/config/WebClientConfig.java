package com.flamingo.ai.filingrag.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for filing downloads. */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

  private final RagConfig ragConfig;

  @Bean
  public WebClient acquisitionWebClient(WebClient.Builder builder) {
    int maxBytes = ragConfig.getAcquisition().getMaxDocumentBytes();
    return builder
        .defaultHeader(HttpHeaders.USER_AGENT, ragConfig.getAcquisition().getUserAgent())
        .exchangeStrategies(
            ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxBytes))
                .build())
        .build();
  }
}
