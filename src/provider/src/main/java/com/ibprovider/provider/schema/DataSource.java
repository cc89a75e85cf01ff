package com.ibprovider.provider.schema;

/** A readable data source: its schema and the function that fills its computed attributes. */
public record DataSource(ResourceSchema schema, ReadFunction readFunction) {
  public DataSource withRead(ReadFunction read) {
    return new DataSource(schema, read);
  }
}
