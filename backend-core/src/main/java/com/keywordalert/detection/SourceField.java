package com.keywordalert.detection;

public enum SourceField {
    FILENAME,
    BODY
}
