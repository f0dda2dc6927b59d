package edge.data.readers;

import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a comma separated table with a header line into one map per row, keyed by column name.
 * Blank lines and lines starting with '#' are skipped.
 */
public class CsvToMap implements ICsvReader {

    @Override
    public List<Map<String, String>> readRows(BufferedReader bufferedReader) throws IOException {

        String[] headers = null;
        List<Map<String, String>> rows = new ArrayList<>();

        String line;
        int lineNumber = 0;

        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            if (StringUtils.isBlank(line) || line.trim().startsWith("#")) {
                continue;
            }
            String[] data = StringUtils.stripAll(line.split(",", -1));
            if (headers == null) {
                headers = data;
                continue;
            }
            if (data.length != headers.length) {
                throw new IllegalArgumentException(String.format("Line %d has %d columns, header has %d",
                        lineNumber, data.length, headers.length));
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int j = 0; j < headers.length; j++) {
                row.put(headers[j], data[j]);
            }
            rows.add(row);
        }

        return rows;
    }
}
