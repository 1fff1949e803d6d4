package io.qdbcompat.query;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed result of an {@code /exec} query: the ordered column schema and the dataset.
 *
 * <p>Every row has exactly as many values as there are columns. Integral numbers are held as
 * {@link Long}, or {@link BigInteger} beyond the long range, and fractional numbers as
 * {@link Double}, whatever width the JSON parser chose.
 */
public final class QueryResponse {

    private final String query;
    private final List<Column> columns;
    private final List<List<Object>> dataset;

    QueryResponse(String query, List<Column> columns, List<List<Object>> dataset) {
        this.query = query;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> rows = new ArrayList<>(dataset.size());
        for (List<Object> row : dataset) {
            rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.dataset = Collections.unmodifiableList(rows);
    }

    /**
     * Parses a response body.
     *
     * @param query SQL text the body answers, used in error messages
     * @param body raw response body
     * @return the parsed response
     * @throws QueryErrorException if the body carries an {@code error} field
     * @throws MalformedResponseException if the body is not a well-formed query result
     */
    public static QueryResponse parse(String query, String body) {
        DocumentContext document;
        try {
            document = JsonPath.parse(body);
        } catch (InvalidJsonException | IllegalArgumentException e) {
            throw new MalformedResponseException(query, body, "not valid JSON", e);
        }
        if (!(document.json() instanceof Map)) {
            throw new MalformedResponseException(query, body, "expected a JSON object", null);
        }

        Map<String, Object> root = document.json();
        if (root.containsKey("error")) {
            throw new QueryErrorException(query, String.valueOf(root.get("error")));
        }
        if (!(root.get("columns") instanceof List) || !(root.get("dataset") instanceof List)) {
            throw new MalformedResponseException(query, body, "missing columns or dataset", null);
        }

        List<Object> rawColumns = document.read("$.columns");
        List<Column> columns = new ArrayList<>(rawColumns.size());
        for (Object rawColumn : rawColumns) {
            if (!(rawColumn instanceof Map)) {
                throw new MalformedResponseException(query, body, "column is not an object", null);
            }
            Object name = ((Map<?, ?>) rawColumn).get("name");
            Object type = ((Map<?, ?>) rawColumn).get("type");
            if (name == null || type == null) {
                throw new MalformedResponseException(query, body, "column without name or type", null);
            }
            columns.add(new Column(name.toString(), type.toString()));
        }

        List<Object> rawRows = document.read("$.dataset");
        List<List<Object>> dataset = new ArrayList<>(rawRows.size());
        for (Object rawRow : rawRows) {
            if (!(rawRow instanceof List)) {
                throw new MalformedResponseException(query, body, "dataset row is not an array", null);
            }
            List<?> values = (List<?>) rawRow;
            if (values.size() != columns.size()) {
                throw new MalformedResponseException(query, body,
                        "row has " + values.size() + " values but there are " + columns.size() + " columns", null);
            }
            List<Object> row = new ArrayList<>(values.size());
            for (Object value : values) {
                row.add(normalize(value));
            }
            dataset.add(row);
        }
        return new QueryResponse(query, columns, dataset);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        // Integers beyond the long range stay BigInteger.
        if (value instanceof BigInteger && ((BigInteger) value).bitLength() < Long.SIZE) {
            return ((BigInteger) value).longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    public String getQuery() {
        return query;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<List<Object>> getDataset() {
        return dataset;
    }

    public int getRowCount() {
        return dataset.size();
    }

    /**
     * Gets the position of a column, or -1 if the response has no such column.
     */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Gets the dataset with one column removed, typically the server-assigned {@code timestamp}.
     * Returns the dataset unchanged if the column is absent.
     */
    public List<List<Object>> getDatasetWithout(String columnName) {
        int index = indexOf(columnName);
        if (index < 0) {
            return dataset;
        }
        List<List<Object>> scrubbed = new ArrayList<>(dataset.size());
        for (List<Object> row : dataset) {
            List<Object> copy = new ArrayList<>(row);
            copy.remove(index);
            scrubbed.add(copy);
        }
        return scrubbed;
    }

    @Override
    public String toString() {
        return "QueryResponse{query=" + query + ", columns=" + columns + ", rows=" + dataset.size() + "}";
    }

    /**
     * A column of the result schema.
     */
    public static final class Column {

        private final String name;
        private final String type;

        public Column(String name, String type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        public static Column of(String name, String type) {
            return new Column(name, type);
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Column)) {
                return false;
            }
            Column other = (Column) o;
            return name.equals(other.name) && type.equals(other.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return "{name=" + name + ", type=" + type + "}";
        }
    }
}
