package com.demo.fit.service;

import com.demo.fit.config.JacksonConfig;
import com.demo.fit.model.StudentProfile;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.service.dto.EvaluationResult;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpFactorEvaluatorTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    private final StudentProfile profile = new StudentProfile("amy@test.edu", 3L,
            mapper.createObjectNode().put("gpa", 3.8), Instant.now(), null, null);

    private final UniversityRecord purdue = new UniversityRecord("purdue", "Purdue University", 46, 50.3,
            "IN", "West Lafayette", "Public Flagship");

    private RestTemplate snakeCaseTemplate() {
        RestTemplate rt = new RestTemplate();
        rt.getMessageConverters().removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
        rt.getMessageConverters().add(0, new MappingJackson2HttpMessageConverter(mapper));
        return rt;
    }

    @Test
    void parsesSnakeCasePayload() {
        RestTemplate rt = snakeCaseTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(rt).build();
        server.expect(requestTo("http://agents.test/hybrid/evaluate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.user_id").value("amy@test.edu"))
                .andExpect(jsonPath("$.profile_version").value(3))
                .andExpect(jsonPath("$.university.university_id").value("purdue"))
                .andRespond(withSuccess("""
                        {
                          "factors": [
                            {"name": "GPA Match", "score": 34, "max": 40, "detail": "3.8 vs 3.7 median"},
                            {"name": "Test Scores", "score": 20, "max": 25, "detail": "1450"}
                          ],
                          "gap_analysis": {"primary_gap": "Essays", "student_strengths": ["Math"]},
                          "essay_angles": [{"essay_prompt": "Why Purdue?", "angle": "Maker"}],
                          "application_timeline": {"recommended_plan": "Early Action", "deadline": "Nov 1"},
                          "match_percentage": 99,
                          "fit_category": "SAFETY"
                        }
                        """, MediaType.APPLICATION_JSON));

        var evaluator = new HttpFactorEvaluator(rt, mapper, "hybrid", "http://agents.test/hybrid/");
        EvaluationResult result = evaluator.evaluate(profile, purdue);

        assertEquals(2, result.getFactors().size());
        assertEquals(34.0, result.getFactors().get(0).score());
        assertEquals("Essays", result.getGapAnalysis().primaryGap());
        assertEquals("Why Purdue?", result.getEssayAngles().get(0).essayPrompt());
        assertEquals("Early Action", result.getApplicationTimeline().recommendedPlan());
        server.verify();
    }

    @Test
    void missingFactorsIsAnInvalidPayload() {
        RestTemplate rt = snakeCaseTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(rt).build();
        server.expect(requestTo("http://agents.test/rag/evaluate"))
                .andRespond(withSuccess("{\"explanation\": \"no factors\"}", MediaType.APPLICATION_JSON));

        var evaluator = new HttpFactorEvaluator(rt, mapper, "rag", "http://agents.test/rag");
        assertThatThrownBy(() -> evaluator.evaluate(profile, purdue))
                .isInstanceOf(EvaluatorUnavailableException.class)
                .hasMessageContaining("invalid payload");
    }

    @Test
    void serverErrorIsUnavailable() {
        RestTemplate rt = snakeCaseTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(rt).build();
        server.expect(requestTo("http://agents.test/rag/evaluate")).andRespond(withServerError());

        var evaluator = new HttpFactorEvaluator(rt, mapper, "rag", "http://agents.test/rag");
        assertThatThrownBy(() -> evaluator.evaluate(profile, purdue))
                .isInstanceOf(EvaluatorUnavailableException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void readTimeoutIsReportedAsTimeout() {
        RestTemplate rt = Mockito.mock(RestTemplate.class);
        Mockito.when(rt.exchange(any(RequestEntity.class), eq(EvaluationResult.class)))
                .thenThrow(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        var evaluator = new HttpFactorEvaluator(rt, mapper, "vertexai", "http://agents.test/vertexai");
        assertThatThrownBy(() -> evaluator.evaluate(profile, purdue))
                .isInstanceOf(EvaluatorTimeoutException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void connectionFailureIsUnavailable() {
        RestTemplate rt = Mockito.mock(RestTemplate.class);
        Mockito.when(rt.exchange(any(RequestEntity.class), eq(EvaluationResult.class)))
                .thenThrow(new ResourceAccessException("I/O error", new ConnectException("Connection refused")));

        var evaluator = new HttpFactorEvaluator(rt, mapper, "firestore", "http://agents.test/firestore");
        assertThatThrownBy(() -> evaluator.evaluate(profile, purdue))
                .isInstanceOf(EvaluatorUnavailableException.class)
                .hasMessageContaining("firestore");
    }
}
