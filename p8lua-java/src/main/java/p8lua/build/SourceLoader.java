package p8lua.build;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Where included modules come from. */
public interface SourceLoader {

    boolean exists(Path path);

    /** The file's text, one char per byte. */
    String read(Path path) throws IOException;

    /** Reads from the file system. */
    static SourceLoader files() {
        return new SourceLoader() {
            @Override
            public boolean exists(Path path) {
                return Files.isRegularFile(path);
            }

            @Override
            public String read(Path path) throws IOException {
                return FileUtils.readFileToString(path.toFile(), StandardCharsets.ISO_8859_1);
            }
        };
    }
}
