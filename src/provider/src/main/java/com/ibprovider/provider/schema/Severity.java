package com.ibprovider.provider.schema;

public enum Severity {
  ERROR,
  WARNING
}
