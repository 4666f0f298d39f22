package io.github.yok.sentilink.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.BooleanUtils;

/**
 * Conversions between JDBC values and the value types held by
 * {@link io.github.yok.sentilink.model.Tabular}.
 *
 * <p>
 * Reading maps every column to {@link String}, {@link Long}, {@link Double}, {@link BigDecimal},
 * {@link Boolean} or {@code null}:
 * </p>
 * <ul>
 * <li>DATE / TIME / TIMESTAMP: ISO-8601 string</li>
 * <li>CLOB / NCLOB: string</li>
 * <li>BINARY / VARBINARY / LONGVARBINARY / BLOB: upper-case hex string</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcValues {

    // SQL type for integral values in generated DDL
    public static final String INTEGRAL_TYPE = "BIGINT";
    // SQL type for decimal values in generated DDL
    public static final String DECIMAL_TYPE = "DOUBLE PRECISION";
    // SQL type for boolean values in generated DDL
    public static final String BOOLEAN_TYPE = "BOOLEAN";

    private JdbcValues() {
        // Utility class; do not instantiate.
    }

    /**
     * Reads one column of the current row.
     *
     * @param rs result set positioned at the target row
     * @param colIndex one-based column index
     * @param sqlType JDBC SQL type from {@link java.sql.ResultSetMetaData#getColumnType}
     * @return converted value, or {@code null}
     * @throws SQLException on column access error
     */
    public static Object read(ResultSet rs, int colIndex, int sqlType) throws SQLException {
        switch (sqlType) {
            case Types.DATE: {
                java.sql.Date date = rs.getDate(colIndex);
                return date == null ? null : date.toLocalDate().toString();
            }
            case Types.TIME: {
                Time time = rs.getTime(colIndex);
                return time == null ? null : time.toLocalTime().toString();
            }
            case Types.TIMESTAMP: {
                Timestamp ts = rs.getTimestamp(colIndex);
                return ts == null ? null : ts.toLocalDateTime().toString();
            }
            case Types.TIMESTAMP_WITH_TIMEZONE: {
                OffsetDateTime odt = rs.getObject(colIndex, OffsetDateTime.class);
                return odt == null ? null : odt.toString();
            }
            case Types.CLOB:
            case Types.NCLOB: {
                Clob clob = rs.getClob(colIndex);
                if (clob == null) {
                    return null;
                }
                try {
                    return clob.getSubString(1, (int) clob.length());
                } finally {
                    clob.free();
                }
            }
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB: {
                byte[] bytes = rs.getBytes(colIndex);
                return bytes == null ? null : Hex.encodeHexString(bytes, false);
            }
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT: {
                long value = rs.getLong(colIndex);
                return rs.wasNull() ? null : value;
            }
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE: {
                double value = rs.getDouble(colIndex);
                return rs.wasNull() ? null : value;
            }
            case Types.DECIMAL:
            case Types.NUMERIC:
                return rs.getBigDecimal(colIndex);
            case Types.BIT:
            case Types.BOOLEAN: {
                boolean value = rs.getBoolean(colIndex);
                return rs.wasNull() ? null : value;
            }
            default:
                return normalize(rs.getObject(colIndex));
        }
    }

    /**
     * Maps an arbitrary Java value onto the supported value types.
     *
     * @param value raw value
     * @return normalized value
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Long
                || value instanceof Double || value instanceof Boolean
                || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof byte[]) {
            return Hex.encodeHexString((byte[]) value, false);
        }
        return value.toString();
    }

    /**
     * Infers the SQL column type used when a table is created.
     *
     * @param sample non-null value of the column, or {@code null} if all are null
     * @param textType SQL type for text and untyped columns
     * @return SQL type for {@code CREATE TABLE}
     */
    public static String sqlTypeFor(Object sample, String textType) {
        if (sample instanceof Long || sample instanceof Integer || sample instanceof Short
                || sample instanceof Byte) {
            return INTEGRAL_TYPE;
        }
        if (sample instanceof Double || sample instanceof Float
                || sample instanceof BigDecimal) {
            return DECIMAL_TYPE;
        }
        if (sample instanceof Boolean) {
            return BOOLEAN_TYPE;
        }
        return textType;
    }

    /**
     * Returns the {@link Types} code matching a type from {@link #sqlTypeFor(Object, String)}.
     *
     * @param sqlType SQL type name
     * @return JDBC type code used to bind {@code null}
     */
    public static int jdbcTypeOf(String sqlType) {
        switch (sqlType) {
            case INTEGRAL_TYPE:
                return Types.BIGINT;
            case DECIMAL_TYPE:
                return Types.DOUBLE;
            case BOOLEAN_TYPE:
                return Types.BOOLEAN;
            default:
                return Types.VARCHAR;
        }
    }

    /**
     * Binds one value to a statement parameter, converting it to the target column type.
     *
     * <p>
     * Values loaded from text sources arrive as strings (numbers from CSV, ISO timestamps such as
     * {@code processed_at}). They are parsed when the target column is temporal, numeric or
     * boolean, so drivers that check parameter types strictly (e.g. PostgreSQL) accept them.
     * Non-string values bound to character columns are sent as their text form.
     * </p>
     *
     * @param ps prepared statement
     * @param index one-based parameter index
     * @param value value to bind, may be {@code null}
     * @param jdbcType {@link Types} code of the target column
     * @throws SQLException on binding error, or if the value cannot be converted
     */
    public static void bind(PreparedStatement ps, int index, Object value, int jdbcType)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, jdbcType);
            return;
        }
        try {
            bindConverted(ps, index, normalize(value), jdbcType);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            throw new SQLException("Cannot convert value '" + value + "' for parameter " + index
                    + " (JDBC type " + jdbcType + "): " + e.getMessage(), e);
        }
    }

    private static void bindConverted(PreparedStatement ps, int index, Object value,
            int jdbcType) throws SQLException {
        switch (jdbcType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                ps.setLong(index, toBigDecimal(value).longValueExact());
                break;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                ps.setDouble(index, value instanceof Double ? (Double) value
                        : toBigDecimal(value).doubleValue());
                break;
            case Types.NUMERIC:
            case Types.DECIMAL:
                ps.setBigDecimal(index, toBigDecimal(value));
                break;
            case Types.BIT:
            case Types.BOOLEAN:
                ps.setBoolean(index, toBoolean(value));
                break;
            case Types.DATE:
                ps.setDate(index, java.sql.Date.valueOf(LocalDate.parse(text(value))));
                break;
            case Types.TIME:
                ps.setTime(index, Time.valueOf(LocalTime.parse(text(value))));
                break;
            case Types.TIMESTAMP:
                ps.setTimestamp(index, Timestamp.valueOf(toLocalDateTime(text(value))));
                break;
            case Types.TIMESTAMP_WITH_TIMEZONE:
                ps.setObject(index, OffsetDateTime.parse(text(value)),
                        Types.TIMESTAMP_WITH_TIMEZONE);
                break;
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                ps.setString(index, value.toString());
                break;
            default:
                bindAsIs(ps, index, value);
        }
    }

    private static void bindAsIs(PreparedStatement ps, int index, Object value)
            throws SQLException {
        if (value instanceof String) {
            ps.setString(index, (String) value);
        } else if (value instanceof Long) {
            ps.setLong(index, (Long) value);
        } else if (value instanceof Double) {
            ps.setDouble(index, (Double) value);
        } else if (value instanceof BigDecimal) {
            ps.setBigDecimal(index, (BigDecimal) value);
        } else if (value instanceof Boolean) {
            ps.setBoolean(index, (Boolean) value);
        } else {
            ps.setObject(index, value);
        }
    }

    private static String text(Object value) {
        return value.toString().trim();
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Long) {
            return BigDecimal.valueOf((Long) value);
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value);
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return new BigDecimal(text(value));
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Long || value instanceof BigDecimal) {
            return toBigDecimal(value).signum() != 0;
        }
        String str = text(value);
        if ("1".equals(str) || "0".equals(str)) {
            return "1".equals(str);
        }
        Boolean parsed = BooleanUtils.toBooleanObject(str);
        if (parsed == null) {
            throw new IllegalArgumentException("not a boolean");
        }
        return parsed;
    }

    // Accepts both "2024-05-01T09:30:00" and "2024-05-01 09:30:00"
    private static LocalDateTime toLocalDateTime(String value) {
        if (value.length() > 10 && value.charAt(10) == ' ') {
            return LocalDateTime.parse(value.substring(0, 10) + "T" + value.substring(11));
        }
        return LocalDateTime.parse(value);
    }
}
