package github.sarthakdev143.photo_framer.exception;

public class RunSetupException extends RuntimeException {

    public RunSetupException(String message) {
        super(message);
    }

    public RunSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
