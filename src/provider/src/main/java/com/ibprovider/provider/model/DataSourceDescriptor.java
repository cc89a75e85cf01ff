package com.ibprovider.provider.model;

import com.ibprovider.provider.schema.ResourceSchema;

public record DataSourceDescriptor(String name, ResourceSchema schema) {}
