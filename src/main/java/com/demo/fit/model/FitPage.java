package com.demo.fit.model;

import java.util.List;

public record FitPage(List<FitView> results, int total, boolean fitsReady, boolean softFitFallback) {}
