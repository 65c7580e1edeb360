package com.demo.fit.service;

import com.demo.fit.model.FitRecord;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/** POST {baseUrl}/generate, expects {"image_url": "..."}. */
public class HttpInfographicGenerator implements InfographicGenerator {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpInfographicGenerator(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public String generate(FitRecord fit, UniversityRecord university) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new EvaluatorUnavailableException("Infographic generator URL missing");
        }
        try {
            var req = RequestEntity
                    .post(URI.create(baseUrl + "/generate"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("fit", fit, "university", university));
            Map resp = restTemplate.exchange(req, Map.class).getBody();
            Object url = resp == null ? null : resp.get("image_url");
            if (url == null || url.toString().isBlank()) {
                throw new EvaluatorUnavailableException("Infographic generator returned no image_url");
            }
            return url.toString();
        } catch (RestClientException ex) {
            throw new EvaluatorUnavailableException("Infographic generation failed: " + ex.getMessage(), ex);
        }
    }
}
