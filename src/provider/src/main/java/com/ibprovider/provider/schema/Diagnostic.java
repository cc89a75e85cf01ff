package com.ibprovider.provider.schema;

public record Diagnostic(Severity severity, String summary, String detail) {}
