package io.refdata.dataset;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * CSV with a typed header ({@code "Date:date","Code:string",...}) so a dataset reads back with the schema it was
 * written with. Every non-null cell is quoted; a null cell is written as nothing, so it stays apart from {@code ""}.
 */
public final class CsvCodec {
    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL_NON_NULL)
            .setNullString("")
            .setRecordSeparator('\n')
            .build();

    private CsvCodec() {}

    public static void write(Path out, TypedDataset dataset) throws IOException {
        if (out.getParent() != null) Files.createDirectories(out.getParent());
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            print(w, dataset);
        }
    }

    public static TypedDataset read(Path in) throws IOException, SchemaException {
        try (Reader r = Files.newBufferedReader(in, StandardCharsets.UTF_8)) {
            return parse(r);
        }
    }

    public static String encode(TypedDataset dataset) {
        StringWriter w = new StringWriter();
        try {
            print(w, dataset);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return w.toString();
    }

    public static TypedDataset decode(String text) throws SchemaException {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new SchemaException("unreadable csv: " + e.getMessage(), e);
        }
    }

    private static void print(Appendable out, TypedDataset dataset) throws IOException {
        List<Column> cols = dataset.columns();
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        List<String> header = new ArrayList<>(cols.size());
        for (Column c : cols) header.add(c.name() + ":" + c.type().label());
        printer.printRecord(header);
        List<String> cells = new ArrayList<>(cols.size());
        for (List<Object> row : dataset.rows()) {
            cells.clear();
            for (int i = 0; i < cols.size(); i++) cells.add(cols.get(i).type().format(row.get(i)));
            printer.printRecord(cells);
        }
        printer.flush();
    }

    private static TypedDataset parse(Reader in) throws IOException, SchemaException {
        try (CSVParser parser = FORMAT.parse(in)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) throw new SchemaException("csv has no header");
            List<Column> cols = header(records.next());
            List<List<Object>> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord rec = records.next();
                if (rec.size() != cols.size()) {
                    throw new SchemaException("csv record " + rec.getRecordNumber() + " has " + rec.size()
                            + " fields, header has " + cols.size());
                }
                Object[] cells = new Object[cols.size()];
                for (int i = 0; i < cells.length; i++) {
                    String text = rec.get(i);
                    cells[i] = text == null ? null : cols.get(i).type().parse(text, cols.get(i).name());
                }
                rows.add(TypedDataset.row(cells));
            }
            return new TypedDataset(cols, rows);
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new SchemaException("malformed csv: " + e.getMessage(), e);
        }
    }

    private static List<Column> header(CSVRecord rec) throws SchemaException {
        List<Column> cols = new ArrayList<>(rec.size());
        for (String h : rec) {
            String field = h == null ? "" : h;
            int colon = field.lastIndexOf(':');
            if (colon <= 0) throw new SchemaException("untyped csv header field '" + field + "'");
            try {
                cols.add(Column.of(field.substring(0, colon), ColumnType.of(field.substring(colon + 1))));
            } catch (IllegalArgumentException e) {
                throw new SchemaException("unknown column type in '" + field + "'", e);
            }
        }
        return cols;
    }
}
