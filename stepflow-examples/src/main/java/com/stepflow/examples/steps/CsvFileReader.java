package com.stepflow.examples.steps;

import com.stepflow.core.AbstractStep;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.Requirements;
import com.stepflow.core.StepKind;
import com.stepflow.core.ValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV file into the data set, one map per row keyed by column name.
 *
 * <p>Configuration: {@code source.path} (required), {@code source.delimiter} (default {@code ,}) and
 * {@code source.header} (default {@code true}; without a header columns are named {@code c0, c1, ...}).
 */
public final class CsvFileReader extends AbstractStep {

    public CsvFileReader() {
        this("read_csv");
    }

    public CsvFileReader(String name) {
        super(name, StepKind.READER, Requirements.builder()
            .config("source.path", String.class)
            .output(Output.DATASET, List.class)
            .output("rows", Long.class)
            .build());
    }

    @Override
    public boolean idempotent() {
        return true;
    }

    @Override
    protected void checkPreconditions(Context context) throws ValidationException {
        String delimiter = context.get("source.delimiter", ",");
        if (delimiter.length() != 1) {
            throw new ValidationException(name(), "source.delimiter must be a single character, got '" + delimiter + "'");
        }
    }

    @Override
    protected void doExecute(Context context, Output input, Output.Builder output) throws IOException {
        Path path = Path.of(context.getString("source.path"));
        boolean header = context.get("source.header", Boolean.TRUE);
        CSVFormat.Builder format = CSVFormat.DEFAULT.builder()
            .setDelimiter(context.get("source.delimiter", ","))
            .setIgnoreEmptyLines(true)
            .setTrim(true);
        if (header) {
            format.setHeader().setSkipHeaderRecord(true);
        }

        List<Map<String, String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = CSVParser.parse(reader, format.build())) {
            List<String> columns = header ? parser.getHeaderNames() : null;
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < record.size(); i++) {
                    String column = columns != null && i < columns.size() ? columns.get(i) : "c" + i;
                    row.put(column, record.get(i));
                }
                rows.add(Collections.unmodifiableMap(row));
            }
        }
        log().info("read {} rows from {}", rows.size(), path);
        output.put(Output.DATASET, List.copyOf(rows)).put("rows", (long) rows.size());
    }
}
