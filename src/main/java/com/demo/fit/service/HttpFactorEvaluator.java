package com.demo.fit.service;

import com.demo.fit.model.StudentProfile;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.service.dto.EvaluationResult;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the agent deployment for one knowledge-base approach: POST {baseUrl}/evaluate.
 * Expects JSON: { "factors":[{"name":"GPA Match","score":31,"max":40,"detail":"..."}],
 *                 "gap_analysis":{...}, "recommendations":[...], "essay_angles":[...],
 *                 "scholarship_matches":[...], "application_timeline":{...} }
 */
@Slf4j
public class HttpFactorEvaluator implements FactorEvaluator {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String approach;
    private final String baseUrl;

    public HttpFactorEvaluator(RestTemplate restTemplate, ObjectMapper objectMapper, String approach, String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.approach = approach;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public EvaluationResult evaluate(StudentProfile profile, UniversityRecord university) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", profile.userId());
        body.put("profile_version", profile.profileVersion());
        body.put("profile", profile.document() == null ? objectMapper.createObjectNode() : profile.document());
        body.put("university", university);

        long started = System.nanoTime();
        try {
            var req = RequestEntity
                    .post(URI.create(baseUrl + "/evaluate"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body);
            ResponseEntity<EvaluationResult> resp = restTemplate.exchange(req, EvaluationResult.class);
            EvaluationResult result = resp.getBody();
            if (result == null || result.getFactors() == null || result.getFactors().isEmpty()) {
                throw new EvaluatorUnavailableException("Evaluator (" + approach + ") returned invalid payload for "
                        + university.universityId());
            }
            log.debug("[EVALUATOR] {} {} -> {} factors in {}ms", approach, university.universityId(),
                    result.getFactors().size(), (System.nanoTime() - started) / 1_000_000);
            return result;
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new EvaluatorTimeoutException("Evaluator (" + approach + ") timed out for "
                        + university.universityId(), ex);
            }
            throw new EvaluatorUnavailableException("Evaluator (" + approach + ") unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new EvaluatorUnavailableException("Evaluator (" + approach + ") call failed: " + ex.getMessage(), ex);
        }
    }

    public String approach() {
        return approach;
    }
}
