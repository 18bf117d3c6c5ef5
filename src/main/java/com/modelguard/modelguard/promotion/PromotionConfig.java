package com.modelguard.modelguard.promotion;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PromotionProperties.class)
public class PromotionConfig {

    @Bean
    public PromotionThresholds promotionThresholds(PromotionProperties promotionProperties) {
        return new PromotionThresholds(promotionProperties.getMinAcceptableMetric());
    }
}
