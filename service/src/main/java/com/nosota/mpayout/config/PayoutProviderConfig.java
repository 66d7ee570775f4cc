package com.nosota.mpayout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient for the payout provider: base URL and partner credentials sent as default headers.
 *
 * <pre>
 * payout:
 *   provider:
 *     base-url: https://api.sparkuptech.in/api/fzep/payout
 *     partner-id: ${PAYOUT_PARTNER_ID}
 *     consumer-key: ${PAYOUT_CONSUMER_KEY}
 *     consumer-secret: ${PAYOUT_CONSUMER_SECRET}
 * </pre>
 */
@Configuration
@Slf4j
public class PayoutProviderConfig {

    private static final int MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    @Bean
    public WebClient payoutProviderWebClient(
            WebClient.Builder builder,
            @Value("${payout.provider.base-url:https://api.sparkuptech.in/api/fzep/payout}") String baseUrl,
            @Value("${payout.provider.partner-id:}") String partnerId,
            @Value("${payout.provider.consumer-key:}") String consumerKey,
            @Value("${payout.provider.consumer-secret:}") String consumerSecret) {

        if (partnerId.isBlank() || consumerKey.isBlank() || consumerSecret.isBlank()) {
            log.warn("Payout provider credentials are not fully configured (base-url={})", baseUrl);
        }

        return builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("partnerid", partnerId)
                .defaultHeader("consumerkey", consumerKey)
                .defaultHeader("consumersecret", consumerSecret)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
