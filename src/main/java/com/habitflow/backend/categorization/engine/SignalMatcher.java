package com.habitflow.backend.categorization.engine;

import java.util.List;

import com.habitflow.backend.categorization.model.MatchSignal;

public interface SignalMatcher {
    List<MatchSignal> match(List<String> tokens);
}
