package com.ibprovider.provider.schema;

import com.ibprovider.connector.IbConnector;

@FunctionalInterface
public interface ReadFunction {
  Diagnostics read(ResourceData data, IbConnector connector);
}
