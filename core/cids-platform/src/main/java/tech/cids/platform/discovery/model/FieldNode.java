package tech.cids.platform.discovery.model;

import java.util.List;

/**
 * A field in a request or response body.
 *
 * <p>Objects carry child fields and arrays carry an item schema. Scalars carry neither,
 * which the sealed variants make unrepresentable rather than checked at runtime.
 */
public sealed interface FieldNode permits FieldNode.ScalarField, FieldNode.ObjectField, FieldNode.ArrayField {

    String name();
    FieldType type();
    String description();
    SensitivityFlags flags();
    boolean required();

    /**
     * A leaf field: string, number, integer, boolean, date or datetime.
     */
    record ScalarField(
        String name,
        FieldType type,
        String description,
        SensitivityFlags flags,
        boolean required,
        String format
    ) implements FieldNode {
        public ScalarField {
            if (type == FieldType.OBJECT || type == FieldType.ARRAY) {
                throw new IllegalArgumentException("Scalar field cannot have type " + type.getValue());
            }
        }
    }

    /**
     * An object field with named children.
     */
    record ObjectField(
        String name,
        String description,
        SensitivityFlags flags,
        boolean required,
        List<FieldNode> fields
    ) implements FieldNode {
        public ObjectField {
            fields = fields != null ? List.copyOf(fields) : List.of();
        }

        @Override
        public FieldType type() {
            return FieldType.OBJECT;
        }
    }

    /**
     * An array field. {@code items} describes one element and may be null when the
     * element schema is not published.
     */
    record ArrayField(
        String name,
        String description,
        SensitivityFlags flags,
        boolean required,
        FieldNode items
    ) implements FieldNode {
        @Override
        public FieldType type() {
            return FieldType.ARRAY;
        }
    }
}
