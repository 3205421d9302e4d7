package com.outagesentinel.detector.gate;

public record ControlVerdict(boolean ok, int passed, int total) {
}
