package com.titiplex.tracker.core.model;

public record Tip(TipKind kind, String message) {
}
