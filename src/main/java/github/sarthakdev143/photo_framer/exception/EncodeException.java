package github.sarthakdev143.photo_framer.exception;

import java.io.IOException;
import java.nio.file.Path;

public class EncodeException extends IOException {

    private final Path target;

    public EncodeException(Path target, String message) {
        super(message);
        this.target = target;
    }

    public EncodeException(Path target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
