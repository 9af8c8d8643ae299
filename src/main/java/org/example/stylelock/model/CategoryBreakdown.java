package org.example.stylelock.model;

public record CategoryBreakdown(int total, int succeeded, int failed, double meanScore) {
}
