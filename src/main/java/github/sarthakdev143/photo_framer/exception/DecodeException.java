package github.sarthakdev143.photo_framer.exception;

import java.io.IOException;
import java.nio.file.Path;

public class DecodeException extends IOException {

    private final Path source;

    public DecodeException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public DecodeException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
