package io.flowcraft.core.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Declared state field as written in a workflow document.
///
/// Holds the raw type expression; parsing and validation happen in
/// {@link StateSchemaBuilder}. Object-typed fields carry their nested
/// declarations in {@link #getFields()}.
///
/// {@snippet :
/// StateFieldDeclaration topic = StateFieldDeclaration.builder("topic")
///         .type("str")
///         .required(true)
///         .description("Article topic")
///         .build();
/// }
public final class StateFieldDeclaration {

    private final String name;
    private final String type;
    private final boolean required;
    private final boolean hasDefault;
    private final Object defaultValue;
    private final String description;
    private final List<StateFieldDeclaration> fields;

    private StateFieldDeclaration(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.required = builder.required;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.description = builder.description;
        this.fields = List.copyOf(builder.fields);
    }

    /// Shorthand for an optional field with no default.
    public static StateFieldDeclaration of(String name, String type) {
        return builder(name).type(type).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /// Returns whether a default was declared. A declared default may itself be null.
    public boolean hasDefault() {
        return hasDefault;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    /// Returns nested declarations for `object` types, empty otherwise.
    public List<StateFieldDeclaration> getFields() {
        return fields;
    }

    public static final class Builder {
        private final String name;
        private String type = "str";
        private boolean required;
        private boolean hasDefault;
        private Object defaultValue;
        private String description;
        private final List<StateFieldDeclaration> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.hasDefault = true;
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder field(StateFieldDeclaration field) {
            this.fields.add(field);
            return this;
        }

        public Builder fields(List<StateFieldDeclaration> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public StateFieldDeclaration build() {
            return new StateFieldDeclaration(this);
        }
    }
}
