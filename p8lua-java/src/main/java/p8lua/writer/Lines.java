package p8lua.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class Lines {
    private Lines() {}

    /** Splits after each {@code \n}, {@code \r\n} or lone {@code \r}, keeping the line endings. */
    static Stream<String> split(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) lines.add(text.substring(start));
        return lines.stream();
    }
}
