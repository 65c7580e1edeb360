package com.demo.fit.model;

import java.util.List;

public record BalancedList(List<FitView> safety, List<FitView> target, List<FitView> reach, boolean fitsReady) {

    public List<FitView> merged() {
        var out = new java.util.ArrayList<FitView>(safety.size() + target.size() + reach.size());
        out.addAll(safety);
        out.addAll(target);
        out.addAll(reach);
        return out;
    }
}
