package aurum.io;

import java.io.IOException;

public class AurbFormatException extends IOException {

    public AurbFormatException(String message) {
        super(message);
    }

    public AurbFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
