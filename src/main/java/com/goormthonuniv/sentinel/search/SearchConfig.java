package com.goormthonuniv.sentinel.search;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class SearchConfig {

    /** 에이전트/탐지/수집이 주입받는 검색 제공자 */
    @Bean
    @Primary
    public SearchProvider searchProvider(BingSearchProvider bing, SentinelProperties properties, Sleeper sleeper) {
        SentinelProperties.Search s = properties.search();
        return new ResilientSearchProvider(bing, s.maxAttempts(), s.initialBackoff(), sleeper);
    }
}
