package com.demo.fit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(FitEngineProperties properties, ObjectMapper objectMapper) {
        var evaluator = properties.evaluator();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory();
        f.setConnectTimeout((int) evaluator.connectTimeout().toMillis());
        // evaluator calls are LLM-backed, reads routinely take tens of seconds
        f.setReadTimeout((int) evaluator.readTimeout().toMillis());
        RestTemplate rt = new RestTemplate(f);
        // agents speak snake_case, same as our own API
        rt.getMessageConverters().removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
        rt.getMessageConverters().add(0, new MappingJackson2HttpMessageConverter(objectMapper));
        return rt;
    }
}
