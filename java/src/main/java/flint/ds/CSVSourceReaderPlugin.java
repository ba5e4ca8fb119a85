package flint.ds;

import java.io.File;
import java.io.IOException;

/**
 * Default plugin for delimited text sources (csv, csv.gz).
 */
public class CSVSourceReaderPlugin implements SourceReaderPlugin {

    public static final String MARKER = "csv";

    @Override
    public String marker() {
        return MARKER;
    }

    @Override
    public SourceReader open(File file, IndexChoice index, Logger logger) throws IOException {
        return CSVSourceReader.open(file, index, logger);
    }
}
