package com.flamingo.ai.finqa.agent.dto;

import java.util.List;

/** Structured output from QueryClassificationAgent. Unknown category names are ignored. */
public record QueryClassificationResult(List<String> categories, String reasoning) {}
