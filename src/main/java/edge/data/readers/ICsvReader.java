package edge.data.readers;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface ICsvReader {

    List<Map<String, String>> readRows(BufferedReader bufferedReader) throws IOException;

}
