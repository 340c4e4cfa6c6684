package github.sarthakdev143.photo_framer.model;

public record ElementConfig(
        TextField name,
        String value,
        boolean bold) {

    public ElementConfig {
        name = name == null ? TextField.NONE : name;
        value = value == null ? "" : value;
    }

    public static ElementConfig of(TextField name) {
        return new ElementConfig(name, null, false);
    }

    public static ElementConfig custom(String value) {
        return new ElementConfig(TextField.CUSTOM, value, false);
    }

    public static ElementConfig none() {
        return new ElementConfig(TextField.NONE, null, false);
    }
}
