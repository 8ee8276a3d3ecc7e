package com.intentbench.evaluation;

public record ErrorFrequency(String error, long count) {
}
