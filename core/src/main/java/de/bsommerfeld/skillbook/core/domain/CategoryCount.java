package de.bsommerfeld.skillbook.core.domain;

public record CategoryCount(String category, int count) {
}
