package com.goormthonuniv.sentinel.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * sentinel.* 바인딩. 로컬 비밀값(API 키 환경변수)은 properties/env.properties로 덮어쓸 수 있고, 파일이 없으면 무시한다.
 */
@Configuration
@EnableConfigurationProperties(SentinelProperties.class)
@PropertySource(value = "classpath:properties/env.properties", ignoreResourceNotFound = true)
public class PropertyConfig {
}
