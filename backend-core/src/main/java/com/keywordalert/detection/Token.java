package com.keywordalert.detection;

public record Token(String text, Script script) {
}
