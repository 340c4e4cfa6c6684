package github.sarthakdev143.photo_framer.model;

public record FileError(
        String fileName,
        String message) {
}
