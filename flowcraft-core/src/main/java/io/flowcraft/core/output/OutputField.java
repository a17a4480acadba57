package io.flowcraft.core.output;

import io.flowcraft.core.state.TypeDescriptor;

/// One validated field of a node result.
///
/// @param name field name, not null
/// @param type parsed type, not null
/// @param description human-readable description, may be null
public record OutputField(String name, TypeDescriptor type, String description) {}
