package polyopt.Util.error;

public class Errors extends RuntimeException {
    public String kind;

    public Errors(String kind_, String message) {
        super(message);
        kind = kind_;
    }

    public Errors(String kind_, String message, Throwable cause) {
        super(message, cause);
        kind = kind_;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
