package github.sarthakdev143.photo_framer.exception;

public class ProcessingException extends RuntimeException {

    private final String step;

    public ProcessingException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
