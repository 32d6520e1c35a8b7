package hlsyde.core;

public class NotFoundException extends ConstraintViolationException {

    public NotFoundException(String message) {
        super(message);
    }
}
