package org.apirepository.calcite;

import org.apache.calcite.adapter.java.JavaTypeFactory;
import org.apache.calcite.linq4j.tree.Primitive;
import org.apache.calcite.rel.type.RelDataType;

import java.util.HashMap;
import java.util.Map;

/**
 * Column types of a repository table, mapped to Java and SQL types.
 */
public enum RestFieldType {

    STRING(String.class, "string"),
    BOOLEAN(Primitive.BOOLEAN),
    INT(Primitive.INT),
    LONG(Primitive.LONG),
    DOUBLE(Primitive.DOUBLE),
    DATE(java.sql.Date.class, "date"),
    TIMESTAMP(java.sql.Timestamp.class, "timestamp");

    /** Java class corresponding to the field type (boxed or reference) */
    private final Class<?> clazz;
    /** Type name used in table definitions */
    private final String simpleName;

    private static final Map<String, RestFieldType> MAP = new HashMap<>();

    static {
        for (RestFieldType value : values()) {
            MAP.put(value.simpleName, value);
        }
    }

    RestFieldType(Primitive primitive) {
        this(primitive.boxClass, primitive.primitiveName);
    }

    RestFieldType(Class<?> clazz, String simpleName) {
        this.clazz = clazz;
        this.simpleName = simpleName;
    }

    /**
     * Returns the nullable SQL type for this field type.
     *
     * @param typeFactory Calcite JavaTypeFactory for type creation.
     */
    public RelDataType toType(JavaTypeFactory typeFactory) {
        RelDataType javaType = typeFactory.createJavaType(clazz);
        RelDataType sqlType = typeFactory.createSqlType(javaType.getSqlTypeName());
        return typeFactory.createTypeWithNullability(sqlType, true);
    }

    /**
     * Looks up the field type by name.
     * @param typeString Lowercase type string (e.g., "int", "string", "timestamp")
     * @return Matching RestFieldType, or null if not found.
     */
    public static RestFieldType of(String typeString) {
        return typeString == null ? null : MAP.get(typeString.trim().toLowerCase());
    }
}
