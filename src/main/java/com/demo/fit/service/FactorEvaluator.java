package com.demo.fit.service;

import com.demo.fit.model.StudentProfile;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.service.dto.EvaluationResult;

/**
 * External, LLM-backed source of factor scores and narrative artifacts. Slow and fallible.
 * Implementations throw {@link com.demo.fit.service.exception.EvaluatorUnavailableException} or
 * {@link com.demo.fit.service.exception.EvaluatorTimeoutException}; they never retry on their own.
 */
public interface FactorEvaluator {

    EvaluationResult evaluate(StudentProfile profile, UniversityRecord university);
}
