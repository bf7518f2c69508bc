package com.archlint.cli;

/**
 * Serialization format of command output.
 */
public enum OutputFormat {
    JSON,
    YAML
}
