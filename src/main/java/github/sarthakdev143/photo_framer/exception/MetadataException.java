package github.sarthakdev143.photo_framer.exception;

public class MetadataException extends Exception {

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
