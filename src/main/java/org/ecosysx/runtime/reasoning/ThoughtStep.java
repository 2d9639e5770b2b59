package org.ecosysx.runtime.reasoning;

public record ThoughtStep(int step, String type, String content) {
}
