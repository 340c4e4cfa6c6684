package github.sarthakdev143.photo_framer.processor;

public enum LogoPosition {
    NONE,
    LEFT,
    RIGHT
}
