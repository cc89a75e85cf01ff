package com.ibprovider.provider.schema;

public enum ValueType {
  STRING,
  INT,
  BOOL,
  LIST,
  MAP
}
