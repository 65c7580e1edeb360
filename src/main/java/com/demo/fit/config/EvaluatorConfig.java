package com.demo.fit.config;

import com.demo.fit.service.FactorEvaluator;
import com.demo.fit.service.HttpFactorEvaluator;
import com.demo.fit.service.HttpInfographicGenerator;
import com.demo.fit.service.InfographicGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;

/**
 * Picks the knowledge-base approach once, at startup. Request handling never looks it up again.
 */
@Slf4j
@Configuration
public class EvaluatorConfig {

    @Bean
    public FactorEvaluator factorEvaluator(RestTemplate restTemplate, ObjectMapper objectMapper,
                                           FitEngineProperties properties) {
        var cfg = properties.evaluator();
        String approach = cfg.approach() == null ? "hybrid" : cfg.approach().trim().toLowerCase(Locale.ROOT);
        String baseUrl = cfg.endpoints() == null ? null : cfg.endpoints().get(approach);
        if (!StringUtils.hasText(baseUrl)) {
            throw new IllegalStateException("No evaluator endpoint configured for approach '" + approach + "'");
        }
        log.info("[EVALUATOR] Using approach={} baseUrl={}", approach, baseUrl);
        return new HttpFactorEvaluator(restTemplate, objectMapper, approach, baseUrl);
    }

    @Bean
    public InfographicGenerator infographicGenerator(RestTemplate restTemplate, FitEngineProperties properties) {
        return new HttpInfographicGenerator(restTemplate, properties.evaluator().infographicUrl());
    }
}
