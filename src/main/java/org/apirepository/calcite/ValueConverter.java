package org.apirepository.calcite;

import org.apache.calcite.avatica.util.DateTimeUtils;
import org.apache.commons.lang3.time.FastDateFormat;

import java.text.ParseException;
import java.util.TimeZone;

/**
 * Converts JSON values to the internal representation Calcite expects for a column type.
 *
 * <p><b>Supported types:</b></p>
 * <ul>
 *   <li>BOOLEAN, INT, LONG, DOUBLE</li>
 *   <li>DATE (days since epoch), TIMESTAMP (millis since epoch)</li>
 *   <li>STRING</li>
 * </ul>
 */
public class ValueConverter {

    private static final TimeZone GMT = TimeZone.getTimeZone("GMT");
    private static final FastDateFormat DATE_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd", GMT);
    private static final FastDateFormat TIMESTAMP_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd'T'HH:mm:ss", GMT);

    private ValueConverter() {
    }

    /**
     * Converts a value to the given column type. Empty strings become null for non-string columns.
     *
     * @param object JSON value (String, Number, Boolean)
     * @param fieldType Target column type
     * @return Converted value, or null
     * @throws IllegalArgumentException If the value cannot be parsed as the column type
     */
    public static Object convert(Object object, RestFieldType fieldType) {
        if (object == null) {
            return null;
        }
        if (fieldType == null) {
            return object.toString();
        }
        if (fieldType != RestFieldType.STRING && object.toString().isEmpty()) {
            return null;
        }

        try {
            switch (fieldType) {
                case BOOLEAN:
                    return object instanceof Boolean ? object : Boolean.parseBoolean(object.toString());

                case INT:
                    return object instanceof Number ? ((Number) object).intValue() : Integer.parseInt(object.toString());

                case LONG:
                    return object instanceof Number ? ((Number) object).longValue() : Long.parseLong(object.toString());

                case DOUBLE:
                    return object instanceof Number ? ((Number) object).doubleValue() : Double.parseDouble(object.toString());

                case DATE:
                    return (int) (DATE_FORMAT.parse(object.toString()).getTime() / DateTimeUtils.MILLIS_PER_DAY);

                case TIMESTAMP:
                    return TIMESTAMP_FORMAT.parse(object.toString()).getTime();

                case STRING:
                default:
                    return object.toString();
            }
        } catch (ParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Failed to parse value: " + object + " as " + fieldType, e);
        }
    }
}
