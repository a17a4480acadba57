package io.flowcraft.core.state;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Turns {@link StateFieldDeclaration}s into a validated {@link StateSchema}.
///
/// All checks run here, at workflow compile time: type expressions are parsed,
/// nested object schemas are built recursively, and declared defaults are
/// validated against their types. A malformed declaration never surfaces
/// while a run is in progress.
///
/// ### Contracts
/// - **Precondition**: declarations not null (may be empty)
/// - **Postcondition**: returned schema satisfies every {@link StateSchema} invariant
///
/// @implNote Stateless and thread-safe.
public final class StateSchemaBuilder {

    private static final Pattern FIELD_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private StateSchemaBuilder() {}

    /// Builds a schema from ordered field declarations.
    ///
    /// @param declarations the top-level fields, not null
    /// @return the validated schema, never null
    /// @throws SchemaBuildException naming the first offending field
    public static StateSchema build(List<StateFieldDeclaration> declarations) {
        return build(declarations, "");
    }

    private static StateSchema build(List<StateFieldDeclaration> declarations, String prefix) {
        List<StateSchema.Field> fields = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (StateFieldDeclaration declaration : declarations) {
            String path = prefix + declaration.getName();

            if (!FIELD_NAME.matcher(declaration.getName()).matches()) {
                throw new SchemaBuildException(path, "invalid field name");
            }
            if (!seen.add(declaration.getName())) {
                throw new SchemaBuildException(path, "duplicate field");
            }
            if (declaration.isRequired() && declaration.hasDefault()) {
                throw new SchemaBuildException(path, "required fields cannot have a default");
            }

            TypeDescriptor type = parseType(declaration, path);

            Object defaultValue = null;
            if (declaration.hasDefault() && declaration.getDefaultValue() != null) {
                try {
                    defaultValue = type.conform(declaration.getDefaultValue(), path);
                } catch (StateValidationException e) {
                    throw new SchemaBuildException(
                            path, "default does not match type " + type.describe(), e);
                }
            }

            fields.add(
                    new StateSchema.Field(
                            declaration.getName(),
                            type,
                            declaration.isRequired(),
                            declaration.hasDefault(),
                            defaultValue,
                            declaration.getDescription()));
        }
        return new StateSchema(fields);
    }

    private static TypeDescriptor parseType(StateFieldDeclaration declaration, String path) {
        boolean usesObject = declaration.getType().contains("object");
        if (!usesObject && !declaration.getFields().isEmpty()) {
            throw new SchemaBuildException(
                    path, "nested fields are only allowed on object types");
        }
        StateSchema nested = null;
        if (usesObject) {
            if (declaration.getFields().isEmpty()) {
                throw new SchemaBuildException(path, "object type requires nested fields");
            }
            nested = build(declaration.getFields(), path + ".");
        }
        try {
            return TypeParser.parse(declaration.getType(), nested);
        } catch (TypeParseException e) {
            throw new SchemaBuildException(path, e.getMessage(), e);
        }
    }
}
