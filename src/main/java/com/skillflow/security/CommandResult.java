package com.skillflow.security;

public record CommandResult(String stdout, String stderr, int exitCode) {
    public boolean isError() {
        return exitCode != 0;
    }
}
