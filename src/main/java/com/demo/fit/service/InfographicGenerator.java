package com.demo.fit.service;

import com.demo.fit.model.FitRecord;
import com.demo.fit.model.UniversityRecord;

/** External image generator for the fit infographic. Returns the URL of the generated image. */
public interface InfographicGenerator {

    String generate(FitRecord fit, UniversityRecord university);
}
