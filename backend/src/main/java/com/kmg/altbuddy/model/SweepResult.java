package com.kmg.altbuddy.model;

public record SweepResult(int removed, int failed) {
}
